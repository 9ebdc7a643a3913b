package velab.check;

import velab.analyze.*;
import velab.errors.Issue;
import velab.errors.IssueContext;
import velab.model.verilog.*;
import velab.scope.Scope;
import velab.util.TransactionalMap;

import java.util.*;

/**
 * Semantic checks run around expansion.
 *
 * Pre-elaboration checks decide whether an instantiation or generate construct may be expanded at all.
 * The post-elaboration check walks a node once everything below it has been expanded, descending into attached
 * instances, generated blocks and inlined blocks. Generate blocks that were never expanded are not checked.
 *
 * Every check reports to the context it was built with and returns whether it raised no errors.
 */
public class TypeChecker {

	private final IssueContext ctx;
	private final TransactionalMap<Identifier, ModuleDeclaration> declarations;
	private final TransactionalMap<Identifier, ModuleDeclaration> elaborations;
	private final Resolver resolver;
	private final Navigator navigator;
	private final Evaluator evaluator;
	private final int maxInstanceDepth;
	private final int maxLoopIterations;

	private boolean deactivated;
	private boolean warnUnresolved;
	private boolean localOnly;

	public TypeChecker(IssueContext ctx, TransactionalMap<Identifier, ModuleDeclaration> declarations,
	                   TransactionalMap<Identifier, ModuleDeclaration> elaborations, Resolver resolver,
	                   Navigator navigator, Evaluator evaluator, int maxInstanceDepth, int maxLoopIterations) {
		this.ctx = ctx;
		this.declarations = declarations;
		this.elaborations = elaborations;
		this.resolver = resolver;
		this.navigator = navigator;
		this.evaluator = evaluator;
		this.maxInstanceDepth = maxInstanceDepth;
		this.maxLoopIterations = maxLoopIterations;
		this.deactivated = false;
		this.warnUnresolved = false;
		this.localOnly = false;
	}

	public TypeChecker deactivate(boolean deactivated) {
		this.deactivated = deactivated;
		return this;
	}

	/**
	 * Report unresolvable hierarchical names as warnings instead of ignoring them. Only meaningful together with
	 * {@link #localOnly(boolean)}.
	 */
	public TypeChecker warnUnresolved(boolean warnUnresolved) {
		this.warnUnresolved = warnUnresolved;
		return this;
	}

	/**
	 * Check a template on its own: hierarchical names are not resolved, and nothing is compared against the
	 * elaborated hierarchy.
	 */
	public TypeChecker localOnly(boolean localOnly) {
		this.localOnly = localOnly;
		return this;
	}

	public boolean preElaborationCheck(ModuleInstantiation mi, Scope scope) {
		if (deactivated) {
			return true;
		}
		Checked checked = new Checked(ctx);
		Optional<ModuleDeclaration> module = declarations.find(mi.getModuleId());
		if (!module.isPresent()) {
			checked.error(new UnresolvedModuleIssue(mi));
			return false;
		}
		Identifier fullId = resolver.getFullId(scope, mi.getInstanceName());
		if (fullId.size() > maxInstanceDepth) {
			checked.error(new InstantiationDepthIssue(mi, fullId, maxInstanceDepth));
		}
		if (!localOnly && !mi.getInstance().isPresent()) {
			elaborations.find(fullId).ifPresent(existing ->
					checked.error(new NameConflictIssue(fullId, mi.getLocation(), existing.getLocation())));
		}

		ModuleInterface iface = new ModuleInterface(module.get());
		List<ArgAssign> parameters = mi.getParameters();
		for (int i = 0; i < parameters.size(); ++i) {
			ArgAssign binding = parameters.get(i);
			if (!iface.parameterFor(binding, i).isPresent()) {
				checked.error(new ArgumentMismatchIssue(mi, binding, ArgumentMismatchIssue.Kind.PARAMETER));
			} else if (!evaluator.isConstant(binding.getValue(), scope)) {
				checked.error(new NonConstantExpressionIssue(binding.getValue()));
			}
		}
		List<ArgAssign> ports = mi.getPorts();
		for (int i = 0; i < ports.size(); ++i) {
			if (!iface.portFor(ports.get(i), i).isPresent()) {
				checked.error(new ArgumentMismatchIssue(mi, ports.get(i), ArgumentMismatchIssue.Kind.PORT));
			}
		}
		return checked.ok;
	}

	public boolean preElaborationCheck(GenerateConstruct construct, Scope scope) {
		if (deactivated) {
			return true;
		}
		Checked checked = new Checked(ctx);
		construct.accept(new GeneratePreCheckVisitor(checked, scope));
		return checked.ok;
	}

	/**
	 * Checks a fully expanded node: a module body, or an item together with everything expanded below it.
	 */
	public boolean postElaborationCheck(VerilogNode node, Scope scope) {
		if (deactivated) {
			return true;
		}
		Checked checked = new Checked(ctx);
		if (node instanceof ModuleDeclaration) {
			checkItems(((ModuleDeclaration) node).getItems(), scope, checked);
		} else if (node instanceof GenerateBlock) {
			checkItems(((GenerateBlock) node).getItems(), scope, checked);
		} else if (node instanceof ModuleItem) {
			((ModuleItem) node).accept(new PostCheckVisitor(checked, scope));
		}
		return checked.ok;
	}

	private void checkItems(List<ModuleItem> items, Scope scope, Checked checked) {
		PostCheckVisitor visitor = new PostCheckVisitor(checked, scope);
		for (ModuleItem item : new ArrayList<>(items)) {
			item.accept(visitor);
		}
	}

	private static final class Checked {
		private final IssueContext ctx;
		private boolean ok;

		Checked(IssueContext ctx) {
			this.ctx = ctx;
			this.ok = true;
		}

		void error(Issue issue) {
			ctx.error(issue);
			ok = false;
		}

		void warning(Issue issue) {
			ctx.warning(issue);
		}
	}

	private class GeneratePreCheckVisitor extends GenerateConstructVisitor<Void, RuntimeException> {
		private final Checked checked;
		private final Scope scope;

		GeneratePreCheckVisitor(Checked checked, Scope scope) {
			this.checked = checked;
			this.scope = scope;
		}

		private void requireConstant(Expression expression) {
			if (!evaluator.isConstant(expression, scope)) {
				checked.error(new NonConstantExpressionIssue(expression));
			}
		}

		@Override
		public Void visit(IfGenerateConstruct ifGenerateConstruct) {
			requireConstant(ifGenerateConstruct.getCondition());
			return null;
		}

		@Override
		public Void visit(CaseGenerateConstruct caseGenerateConstruct) {
			requireConstant(caseGenerateConstruct.getSubject());
			for (CaseGenerateItem item : caseGenerateConstruct.getItems()) {
				for (Expression match : item.getMatches()) {
					requireConstant(match);
				}
			}
			return null;
		}

		@Override
		public Void visit(LoopGenerateConstruct loopGenerateConstruct) {
			String genvar = loopGenerateConstruct.getGenvar();
			Optional<Declaration> declaration = resolver.resolveName(genvar, scope);
			if (!declaration.isPresent() || !(declaration.get() instanceof GenvarDeclaration)) {
				checked.error(new UnresolvedReferenceIssue(Identifier.of(genvar), loopGenerateConstruct.getLocation()));
				return null;
			}
			Optional<Long> init = evaluator.evaluate(loopGenerateConstruct.getInit(), scope);
			if (!init.isPresent()) {
				checked.error(new NonConstantExpressionIssue(loopGenerateConstruct.getInit()));
				return null;
			}
			Map<String, Long> bindings = new HashMap<>();
			bindings.put(genvar, init.get());
			for (int iterations = 0; ; ++iterations) {
				Optional<Long> condition = evaluator.evaluate(loopGenerateConstruct.getCondition(), scope, bindings);
				if (!condition.isPresent()) {
					checked.error(new NonConstantExpressionIssue(loopGenerateConstruct.getCondition()));
					return null;
				}
				if (condition.get() == 0) {
					return null;
				}
				if (iterations >= maxLoopIterations) {
					checked.error(new GenerateLoopLimitIssue(loopGenerateConstruct, maxLoopIterations));
					return null;
				}
				Optional<Long> next = evaluator.evaluate(loopGenerateConstruct.getUpdate(), scope, bindings);
				if (!next.isPresent()) {
					checked.error(new NonConstantExpressionIssue(loopGenerateConstruct.getUpdate()));
					return null;
				}
				bindings.put(genvar, next.get());
			}
		}
	}

	private class PostCheckVisitor extends ModuleItemVisitor<Void, RuntimeException> {
		private final Checked checked;
		private final Scope scope;
		private final ItemNameVisitor itemNames;

		PostCheckVisitor(Checked checked, Scope scope) {
			this.checked = checked;
			this.scope = scope;
			this.itemNames = new ItemNameVisitor();
		}

		private void checkUnique(ModuleItem item) {
			if (!scope.getNode().isPresent()) {
				return;
			}
			item.accept(itemNames).ifPresent(name -> {
				List<VerilogNode> claims = navigator.lookupAll(scope.getNode().get(), name);
				if (!claims.isEmpty() && claims.get(0) != item) {
					checked.error(new NameConflictIssue(
							scope.getPath().append(name), item.getLocation(), claims.get(0).getLocation()));
				}
			});
		}

		private void checkExpression(Expression expression) {
			for (Reference reference : References.in(expression)) {
				if (resolver.resolve(reference, scope, localOnly).isPresent()) {
					continue;
				}
				UnresolvedReferenceIssue issue = new UnresolvedReferenceIssue(
						reference.getId(), reference.getLocation());
				if (localOnly && reference.getId().isHierarchical()) {
					if (warnUnresolved) {
						checked.warning(issue);
					}
				} else {
					checked.error(issue);
				}
			}
		}

		private void checkDeclaration(Declaration declaration) {
			checkUnique(declaration);
			declaration.getValue().ifPresent(this::checkExpression);
		}

		private void checkGenerated(GenerateConstruct construct) {
			for (GenerateBlock block : construct.getGenerated()) {
				checkItems(block.getItems(), scope.enter(block), checked);
			}
		}

		@Override
		public Void visit(PortDeclaration portDeclaration) {
			checkUnique(portDeclaration);
			return null;
		}

		@Override
		public Void visit(GenvarDeclaration genvarDeclaration) {
			checkUnique(genvarDeclaration);
			return null;
		}

		@Override
		public Void visit(IntegerDeclaration integerDeclaration) {
			checkDeclaration(integerDeclaration);
			return null;
		}

		@Override
		public Void visit(LocalparamDeclaration localparamDeclaration) {
			checkDeclaration(localparamDeclaration);
			return null;
		}

		@Override
		public Void visit(NetDeclaration netDeclaration) {
			checkDeclaration(netDeclaration);
			return null;
		}

		@Override
		public Void visit(ParameterDeclaration parameterDeclaration) {
			checkDeclaration(parameterDeclaration);
			return null;
		}

		@Override
		public Void visit(RegDeclaration regDeclaration) {
			checkDeclaration(regDeclaration);
			return null;
		}

		@Override
		public Void visit(ContinuousAssign continuousAssign) {
			checkExpression(continuousAssign.getLHS());
			checkExpression(continuousAssign.getRHS());
			resolver.resolve(continuousAssign.getLHS(), scope, localOnly).ifPresent(target -> {
				if (!(target instanceof NetDeclaration) && !(target instanceof PortDeclaration)) {
					checked.error(new InvalidAssignmentTargetIssue(continuousAssign, target));
				}
			});
			return null;
		}

		@Override
		public Void visit(ModuleInstantiation moduleInstantiation) {
			checkUnique(moduleInstantiation);
			for (ArgAssign binding : moduleInstantiation.getParameters()) {
				checkExpression(binding.getValue());
			}
			for (ArgAssign binding : moduleInstantiation.getPorts()) {
				checkExpression(binding.getValue());
			}
			if (moduleInstantiation.isInlined()) {
				GenerateBlock block = moduleInstantiation.getInlined().get();
				checkItems(block.getItems(), scope.enter(block), checked);
			} else if (!localOnly && moduleInstantiation.getInstance().isPresent()) {
				ModuleDeclaration instance = moduleInstantiation.getInstance().get();
				Identifier fullId = resolver.getFullId(scope, moduleInstantiation.getInstanceName());
				Checked nested = new Checked(checked.ctx.withContext(new WhileElaboratingScope(fullId)));
				checkItems(instance.getItems(), Scope.root(instance, fullId), nested);
				if (!nested.ok) {
					checked.ok = false;
				}
			}
			return null;
		}

		@Override
		public Void visit(IfGenerateConstruct ifGenerateConstruct) {
			checkGenerated(ifGenerateConstruct);
			return null;
		}

		@Override
		public Void visit(CaseGenerateConstruct caseGenerateConstruct) {
			checkGenerated(caseGenerateConstruct);
			return null;
		}

		@Override
		public Void visit(LoopGenerateConstruct loopGenerateConstruct) {
			checkGenerated(loopGenerateConstruct);
			return null;
		}
	}
}
