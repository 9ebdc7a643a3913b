package velab.model.verilog;

public abstract class ModuleItemVisitor<T, E extends Throwable> {
	public abstract T visit(PortDeclaration portDeclaration) throws E;
	public abstract T visit(GenvarDeclaration genvarDeclaration) throws E;
	public abstract T visit(IntegerDeclaration integerDeclaration) throws E;
	public abstract T visit(LocalparamDeclaration localparamDeclaration) throws E;
	public abstract T visit(NetDeclaration netDeclaration) throws E;
	public abstract T visit(ParameterDeclaration parameterDeclaration) throws E;
	public abstract T visit(RegDeclaration regDeclaration) throws E;
	public abstract T visit(ContinuousAssign continuousAssign) throws E;
	public abstract T visit(ModuleInstantiation moduleInstantiation) throws E;
	public abstract T visit(IfGenerateConstruct ifGenerateConstruct) throws E;
	public abstract T visit(CaseGenerateConstruct caseGenerateConstruct) throws E;
	public abstract T visit(LoopGenerateConstruct loopGenerateConstruct) throws E;
}
