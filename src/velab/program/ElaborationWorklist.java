package velab.program;

import velab.analyze.Evaluator;
import velab.analyze.Navigator;
import velab.analyze.Resolver;
import velab.check.NameConflictIssue;
import velab.check.TypeChecker;
import velab.errors.IssueContext;
import velab.model.verilog.*;
import velab.scope.Scope;
import velab.transform.Elaborator;
import velab.util.SourceLocation;
import velab.util.TransactionalMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Expands a node to a fixed point.
 *
 * The node is traversed once to seed the queues. Each drain cycle then checks and expands every queued
 * instantiation, followed by every queued generate construct, traversing each expansion so that the work it
 * contains is queued too. Instantiations found while draining the instantiation queue are drained in the same
 * cycle; generate constructs found anywhere wait for the generate pass. Cycles repeat until both queues are
 * empty or an error is reported, after which the whole node gets its post-elaboration check.
 *
 * Generate constructs run after every instantiation of their cycle, even when they were discovered earlier.
 * This only matters once parameter overrides can depend on generated names, which they cannot.
 *
 * Elaborated instances are never inserted into the instance table directly; they are handed to the
 * {@link InstanceSink} the caller provides.
 */
public class ElaborationWorklist {

	@FunctionalInterface
	public interface InstanceSink {
		/**
		 * @return false if the name is already taken
		 */
		boolean insert(Identifier id, ModuleDeclaration instance);
	}

	private final Logger logger;
	private final TransactionalMap<Identifier, ModuleDeclaration> declarations;
	private final TransactionalMap<Identifier, ModuleDeclaration> elaborations;
	private final Navigator navigator;
	private final Resolver resolver;
	private final Evaluator evaluator;
	private final Elaborator elaborator;
	private final int maxInstanceDepth;
	private final int maxLoopIterations;

	public ElaborationWorklist(Logger logger, TransactionalMap<Identifier, ModuleDeclaration> declarations,
	                           TransactionalMap<Identifier, ModuleDeclaration> elaborations, Navigator navigator,
	                           Resolver resolver, Evaluator evaluator, Elaborator elaborator, int maxInstanceDepth,
	                           int maxLoopIterations) {
		this.logger = logger;
		this.declarations = declarations;
		this.elaborations = elaborations;
		this.navigator = navigator;
		this.resolver = resolver;
		this.evaluator = evaluator;
		this.elaborator = elaborator;
		this.maxInstanceDepth = maxInstanceDepth;
		this.maxLoopIterations = maxLoopIterations;
	}

	/**
	 * @param node           a module body, or an item placed in {@code scope}
	 * @param scope          the scope {@code node} opens if it is a module body, otherwise the scope it lives in
	 * @param rootAttributes attributes merged into instances whose instantiation carries none
	 * @return whether the node was expanded and checked without errors
	 */
	public boolean elaborate(VerilogNode node, Scope scope, ElaborationMode mode, Optional<Attributes> rootAttributes,
	                         InstanceSink sink, IssueContext ctx) {
		TypeChecker checker = new TypeChecker(ctx, declarations, elaborations, resolver, navigator, evaluator,
				maxInstanceDepth, maxLoopIterations)
				.deactivate(mode.isCheckerOff())
				.warnUnresolved(mode.isWarnUnresolved())
				.localOnly(mode.isLocalOnly());

		List<Pending<ModuleInstantiation>> instantiations = new ArrayList<>();
		List<Pending<GenerateConstruct>> generates = new ArrayList<>();
		seed(node, scope, instantiations, generates);

		boolean ok = true;
		int cycle = 0;
		while (ok && (!instantiations.isEmpty() || !generates.isEmpty())) {
			++cycle;
			logger.fine("drain cycle " + cycle + " (" + mode + "): " + instantiations.size() + " instantiation(s), " +
					generates.size() + " generate construct(s)");

			for (int i = 0; ok && i < instantiations.size(); ++i) {
				Pending<ModuleInstantiation> pending = instantiations.get(i);
				ModuleInstantiation mi = pending.getNode();
				if (!checker.preElaborationCheck(mi, pending.getScope())) {
					ok = false;
					continue;
				}
				if (!mode.isExpandInstantiations()) {
					continue;
				}
				Optional<ModuleDeclaration> expanded = elaborator.elaborate(mi, pending.getScope());
				if (!expanded.isPresent()) {
					continue;
				}
				ModuleDeclaration instance = expanded.get();
				Identifier id = resolver.getFullId(pending.getScope(), mi.getInstanceName());
				new ElaborationTraversalVisitor(Scope.root(instance, id), evaluator, instantiations, generates)
						.traverseBody(instance.getItems());
				navigator.invalidate(mi);
				if (!mi.getAttributes().isEmpty()) {
					instance.getAttributes().setOrReplace(mi.getAttributes());
				} else {
					rootAttributes.ifPresent(instance.getAttributes()::setOrReplace);
				}
				if (!sink.insert(id, instance)) {
					SourceLocation previous = elaborations.find(id).map(VerilogNode::getLocation)
							.orElse(SourceLocation.unknown());
					ctx.error(new NameConflictIssue(id, mi.getLocation(), previous));
					ok = false;
				}
			}
			instantiations.clear();

			for (int i = 0; ok && i < generates.size(); ++i) {
				Pending<GenerateConstruct> pending = generates.get(i);
				GenerateConstruct construct = pending.getNode();
				if (!checker.preElaborationCheck(construct, pending.getScope())) {
					ok = false;
					continue;
				}
				if (!mode.isExpandGenerates()) {
					continue;
				}
				for (GenerateBlock block : elaborator.elaborate(construct, pending.getScope())) {
					new ElaborationTraversalVisitor(pending.getScope().enter(block), evaluator, instantiations, generates)
							.traverseBody(block.getItems());
				}
				navigator.invalidate(construct);
			}
			generates.clear();
		}

		if (ok) {
			ok = checker.postElaborationCheck(node, scope);
		}
		return ok;
	}

	private void seed(VerilogNode node, Scope scope, List<Pending<ModuleInstantiation>> instantiations,
	                  List<Pending<GenerateConstruct>> generates) {
		ElaborationTraversalVisitor traversal =
				new ElaborationTraversalVisitor(scope, evaluator, instantiations, generates);
		if (node instanceof ModuleDeclaration) {
			traversal.traverseBody(((ModuleDeclaration) node).getItems());
		} else if (node instanceof ModuleItem) {
			((ModuleItem) node).accept(traversal);
		} else if (node instanceof GenerateBlock) {
			traversal.traverseBody(((GenerateBlock) node).getItems());
		}
	}
}
