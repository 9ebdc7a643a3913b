package velab.model.verilog;

public abstract class GenerateConstructVisitor<T, E extends Throwable> {
	public abstract T visit(IfGenerateConstruct ifGenerateConstruct) throws E;
	public abstract T visit(CaseGenerateConstruct caseGenerateConstruct) throws E;
	public abstract T visit(LoopGenerateConstruct loopGenerateConstruct) throws E;
}
