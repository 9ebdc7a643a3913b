package velab.model.verilog;

public abstract class VerilogNodeVisitor<T, E extends Throwable> {

	public abstract T visit(ModuleDeclaration moduleDeclaration) throws E;
	public abstract T visit(ModuleItem moduleItem) throws E;
	public abstract T visit(GenerateBlock generateBlock) throws E;
	public abstract T visit(CaseGenerateItem caseGenerateItem) throws E;
	public abstract T visit(ArgAssign argAssign) throws E;
	public abstract T visit(Attributes attributes) throws E;
	public abstract T visit(AttrSpec attrSpec) throws E;
	public abstract T visit(Expression expression) throws E;

}
