package velab.program;

import velab.analyze.Evaluator;
import velab.model.verilog.*;
import velab.scope.Scope;

import java.util.List;

/**
 * Walks a freshly built or freshly expanded subtree and sorts what it finds: instantiations and generate
 * constructs are queued for the worklist, and declarations get their initial value on the spot, so that later
 * declarations and queued constructs can use it.
 *
 * The walk does not descend into generate blocks that have not been expanded, nor into instances attached to
 * instantiations.
 */
public class ElaborationTraversalVisitor extends ModuleItemVisitor<Void, RuntimeException> {

	private final Scope scope;
	private final Evaluator evaluator;
	private final List<Pending<ModuleInstantiation>> instantiations;
	private final List<Pending<GenerateConstruct>> generates;

	public ElaborationTraversalVisitor(Scope scope, Evaluator evaluator,
	                                   List<Pending<ModuleInstantiation>> instantiations,
	                                   List<Pending<GenerateConstruct>> generates) {
		this.scope = scope;
		this.evaluator = evaluator;
		this.instantiations = instantiations;
		this.generates = generates;
	}

	/**
	 * Traverses a module body or generate block. {@code scope} must already be the scope that node opens.
	 */
	public void traverseBody(List<ModuleItem> items) {
		for (ModuleItem item : items) {
			item.accept(this);
		}
	}

	private Void declaration(Declaration declaration) {
		evaluator.initValue(declaration, scope);
		return null;
	}

	private Void generate(GenerateConstruct construct) {
		generates.add(new Pending<>(construct, scope));
		return null;
	}

	@Override
	public Void visit(PortDeclaration portDeclaration) {
		return null;
	}

	@Override
	public Void visit(GenvarDeclaration genvarDeclaration) {
		return declaration(genvarDeclaration);
	}

	@Override
	public Void visit(IntegerDeclaration integerDeclaration) {
		return declaration(integerDeclaration);
	}

	@Override
	public Void visit(LocalparamDeclaration localparamDeclaration) {
		return declaration(localparamDeclaration);
	}

	@Override
	public Void visit(NetDeclaration netDeclaration) {
		return declaration(netDeclaration);
	}

	@Override
	public Void visit(ParameterDeclaration parameterDeclaration) {
		return declaration(parameterDeclaration);
	}

	@Override
	public Void visit(RegDeclaration regDeclaration) {
		return declaration(regDeclaration);
	}

	@Override
	public Void visit(ContinuousAssign continuousAssign) {
		return null;
	}

	@Override
	public Void visit(ModuleInstantiation moduleInstantiation) {
		instantiations.add(new Pending<>(moduleInstantiation, scope));
		return null;
	}

	@Override
	public Void visit(IfGenerateConstruct ifGenerateConstruct) {
		return generate(ifGenerateConstruct);
	}

	@Override
	public Void visit(CaseGenerateConstruct caseGenerateConstruct) {
		return generate(caseGenerateConstruct);
	}

	@Override
	public Void visit(LoopGenerateConstruct loopGenerateConstruct) {
		return generate(loopGenerateConstruct);
	}
}
