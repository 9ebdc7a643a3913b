package velab.program;

import velab.ElaborationOptions;
import velab.analyze.*;
import velab.check.TypeChecker;
import velab.errors.IssueContext;
import velab.errors.TopLevelIssueContext;
import velab.model.verilog.*;
import velab.scope.Scope;
import velab.transform.Elaborator;
import velab.transform.Inliner;
import velab.util.SourceLocation;
import velab.util.TransactionalMap;

import java.util.*;
import java.util.logging.Logger;

/**
 * A design under incremental elaboration.
 *
 * Modules are declared one at a time and checked on their own. The first item evaluated must instantiate the
 * most recently declared module and becomes the root of the design; every later item is appended to the root
 * instance and elaborated in place.
 *
 * Every call is all-or-nothing: when it fails, both tables and the root are left exactly as they were, the
 * rejected input is released and the reasons are reported to the given context. The program stays usable.
 */
public class Program {

	private final Logger logger;
	private final int maxInstanceDepth;
	private final int maxLoopIterations;

	private final TransactionalMap<Identifier, ModuleDeclaration> declarations;
	private final TransactionalMap<Identifier, ModuleDeclaration> elaborations;

	private final Navigator navigator;
	private final Resolver resolver;
	private final Evaluator evaluator;
	private final HierarchyInfo hierarchyInfo;
	private final ElaborationWorklist worklist;
	private final HierarchyFlattener flattener;

	private boolean checkerOff;

	private ModuleDeclaration rootDeclaration;
	private ModuleDeclaration lastDeclaration;
	private ModuleInstantiation rootInstantiation;
	private Identifier rootId;

	public Program() {
		this(new ElaborationOptions());
	}

	public Program(ElaborationOptions options) {
		this.logger = Logger.getLogger(Program.class.getName());
		options.configureLogging(logger);
		this.maxInstanceDepth = options.getMaxInstanceDepth();
		this.maxLoopIterations = options.getMaxLoopIterations();
		this.checkerOff = !options.isTypecheck();

		this.declarations = new TransactionalMap<>();
		this.elaborations = new TransactionalMap<>();
		this.navigator = new Navigator();
		this.resolver = new Resolver(navigator);
		this.evaluator = new Evaluator(resolver);
		this.hierarchyInfo = new HierarchyInfo(elaborations);
		Elaborator elaborator = new Elaborator(declarations, evaluator, maxLoopIterations);
		this.worklist = new ElaborationWorklist(logger, declarations, elaborations, navigator, resolver, evaluator,
				elaborator, maxInstanceDepth, maxLoopIterations);
		this.flattener = new HierarchyFlattener(elaborations, hierarchyInfo, new Inliner(), resolver, navigator);

		this.rootDeclaration = null;
		this.lastDeclaration = null;
		this.rootInstantiation = null;
		this.rootId = null;
	}

	/**
	 * Declares {@code md} and makes an instance of it the root of the design.
	 */
	public Program(ElaborationOptions options, ModuleDeclaration md, IssueContext ctx) {
		this(options);
		declareAndInstantiate(md, ctx);
	}

	/**
	 * Declares {@code md} and evaluates {@code mi}, which should instantiate it, as the root of the design.
	 */
	public Program(ElaborationOptions options, ModuleDeclaration md, ModuleInstantiation mi, IssueContext ctx) {
		this(options);
		if (declare(md, ctx)) {
			eval(mi, ctx);
		}
	}

	/**
	 * Turns the type checker on or off for subsequent calls.
	 */
	public Program typecheck(boolean enable) {
		this.checkerOff = !enable;
		return this;
	}

	public boolean declare(ModuleDeclaration md, IssueContext ctx) {
		logger.info("Declaring module " + md.getId());
		TopLevelIssueContext local = new TopLevelIssueContext();
		IssueContext nested = local.withContext(new WhileDeclaringModule(md.getId()));

		if (md.getAttributes().isEmpty() && rootDeclaration != null) {
			md.replaceAttributes(rootDeclaration.getAttributes().copy());
		}

		Optional<ModuleDeclaration> existing = declarations.find(md.getId());
		if (existing.isPresent()) {
			nested.error(new DuplicateDeclarationIssue(md, existing.get()));
		} else {
			worklist.elaborate(md, Scope.root(md, md.getId()), ElaborationMode.local(checkerOff), Optional.empty(),
					this::insertElaboration, nested);
		}

		if (local.hasErrors()) {
			logger.warning("Declaration of module " + md.getId() + " rejected");
			release(md);
			local.copyTo(ctx);
			return false;
		}

		declarations.checkpoint();
		declarations.insert(md.getId(), md);
		declarations.commit();
		if (rootDeclaration == null) {
			rootDeclaration = md;
		}
		lastDeclaration = md;
		local.copyTo(ctx);
		return true;
	}

	/**
	 * Declares {@code md} and, if that worked, evaluates an instantiation of it without bindings, named after
	 * the module in lower case.
	 */
	public boolean declareAndInstantiate(ModuleDeclaration md, IssueContext ctx) {
		if (!declare(md, ctx)) {
			return false;
		}
		ModuleInstantiation mi = new ModuleInstantiation(
				SourceLocation.unknown(),
				new Attributes(SourceLocation.unknown(), Collections.emptyList()),
				md.getId(),
				md.getId().toString().toLowerCase(Locale.ROOT),
				Collections.emptyList(),
				Collections.emptyList());
		return eval(mi, ctx);
	}

	public boolean eval(ModuleItem item, IssueContext ctx) {
		if (rootInstantiation == null) {
			return evalRoot(item, ctx);
		}
		return evalItem(item, ctx);
	}

	/**
	 * Elaborates {@code item} as the root of the design. It must instantiate the most recently declared
	 * module.
	 */
	public boolean evalRoot(ModuleItem item, IssueContext ctx) {
		TopLevelIssueContext local = new TopLevelIssueContext();
		if (lastDeclaration == null) {
			local.error(new NoRootDeclarationIssue(item));
			return reject(item, local, ctx);
		}
		if (!(item instanceof ModuleInstantiation) ||
				!((ModuleInstantiation) item).getModuleId().equals(lastDeclaration.getId())) {
			local.error(new RootInstantiationMismatchIssue(item, lastDeclaration.getId()));
			return reject(item, local, ctx);
		}
		ModuleInstantiation mi = (ModuleInstantiation) item;
		logger.info("Elaborating root instance " + mi.getInstanceName() + " of module " + mi.getModuleId());

		elaborations.checkpoint();
		boolean ok = worklist.elaborate(mi, Scope.top(), ElaborationMode.full(checkerOff), Optional.empty(),
				this::insertElaboration, local);
		if (!ok) {
			dispose(elaborations.undo());
			return reject(item, local, ctx);
		}
		elaborations.commit();
		rootInstantiation = mi;
		rootId = resolver.getFullId(Scope.top(), mi.getInstanceName());
		local.copyTo(ctx);
		return true;
	}

	/**
	 * Appends {@code item} to the root instance and elaborates it there.
	 */
	public boolean evalItem(ModuleItem item, IssueContext ctx) {
		TopLevelIssueContext local = new TopLevelIssueContext();
		Optional<ModuleDeclaration> root = getRootInstance();
		if (!root.isPresent()) {
			local.error(new NoRootDeclarationIssue(item));
			return reject(item, local, ctx);
		}
		logger.info("Evaluating item in " + rootId);

		List<ModuleItem> rootItems = root.get().getItems();
		int previousSize = rootItems.size();
		rootItems.add(item);

		elaborations.checkpoint();
		boolean ok = worklist.elaborate(item, Scope.root(root.get(), rootId), ElaborationMode.full(checkerOff),
				Optional.of(rootInstantiation.getAttributes()), this::insertElaboration, local);
		if (ok) {
			elaborations.commit();
			local.copyTo(ctx);
		} else {
			dispose(elaborations.undo());
			resolver.invalidate(item);
			navigator.invalidate(root.get());
			while (rootItems.size() > previousSize) {
				rootItems.remove(rootItems.size() - 1);
			}
			reject(item, local, ctx);
		}
		for (Map.Entry<Identifier, ModuleDeclaration> entry : elaborations) {
			hierarchyInfo.invalidate(entry.getKey());
		}
		return ok;
	}

	public void inlineAll() {
		if (rootId != null) {
			inlineAll(rootId);
		}
	}

	public void inlineAll(Identifier instanceId) {
		logger.fine("Inlining below " + instanceId);
		flattener.inlineAll(instanceId);
	}

	public void outlineAll() {
		if (rootId != null) {
			outlineAll(rootId);
		}
	}

	public void outlineAll(Identifier instanceId) {
		logger.fine("Outlining below " + instanceId);
		flattener.outlineAll(instanceId);
	}

	/**
	 * Re-runs the post-elaboration check over the whole design as it currently stands, flattened or not.
	 */
	public boolean check(IssueContext ctx) {
		if (rootInstantiation == null) {
			return true;
		}
		TypeChecker checker = new TypeChecker(ctx, declarations, elaborations, resolver, navigator, evaluator,
				maxInstanceDepth, maxLoopIterations)
				.deactivate(checkerOff);
		return checker.postElaborationCheck(rootInstantiation, Scope.top());
	}

	/**
	 * The first module ever declared. Modules declared without attributes inherit its attributes.
	 */
	public Optional<ModuleDeclaration> getRootDeclaration() {
		return Optional.ofNullable(rootDeclaration);
	}

	public Optional<ModuleDeclaration> getLastDeclaration() {
		return Optional.ofNullable(lastDeclaration);
	}

	public Optional<ModuleInstantiation> getRootInstantiation() {
		return Optional.ofNullable(rootInstantiation);
	}

	public Optional<Identifier> getRootId() {
		return Optional.ofNullable(rootId);
	}

	/**
	 * The elaborated body of the root instance; evaluated items end up here.
	 */
	public Optional<ModuleDeclaration> getRootInstance() {
		return rootId == null ? Optional.empty() : elaborations.find(rootId);
	}

	public Optional<ModuleDeclaration> getDeclaration(Identifier id) {
		return declarations.find(id);
	}

	public Optional<ModuleDeclaration> getElaboration(Identifier id) {
		return elaborations.find(id);
	}

	public Iterable<Map.Entry<Identifier, ModuleDeclaration>> getDeclarations() {
		return declarations;
	}

	public Iterable<Map.Entry<Identifier, ModuleDeclaration>> getElaborations() {
		return elaborations;
	}

	public int declarationCount() {
		return declarations.size();
	}

	public int elaborationCount() {
		return elaborations.size();
	}

	public Navigator getNavigator() {
		return navigator;
	}

	public Resolver getResolver() {
		return resolver;
	}

	public HierarchyInfo getHierarchyInfo() {
		return hierarchyInfo;
	}

	private boolean insertElaboration(Identifier id, ModuleDeclaration instance) {
		return elaborations.insert(id, instance);
	}

	private boolean reject(ModuleItem item, TopLevelIssueContext local, IssueContext ctx) {
		logger.warning("Evaluation rolled back with " + local.getIssues().size() + " error(s)");
		release(item);
		local.copyTo(ctx);
		return false;
	}

	/**
	 * Drops everything derived from instances that a rollback took out of the instance table.
	 */
	private void dispose(List<Map.Entry<Identifier, ModuleDeclaration>> undone) {
		for (Map.Entry<Identifier, ModuleDeclaration> entry : undone) {
			hierarchyInfo.invalidate(entry.getKey());
			resolver.invalidate(entry.getValue());
			navigator.invalidate(entry.getValue());
		}
	}

	/**
	 * Forgets a rejected input: cached lookups into or out of it are dropped and everything elaboration attached
	 * to it is detached, so the same node can be submitted again.
	 */
	private void release(VerilogNode node) {
		resolver.invalidate(node);
		for (VerilogNode descendant : Descendants.collect(node, true)) {
			if (descendant instanceof ModuleInstantiation) {
				ModuleInstantiation mi = (ModuleInstantiation) descendant;
				mi.getInstance().ifPresent(navigator::invalidate);
				mi.clearInstance();
				mi.clearInlined();
			} else if (descendant instanceof GenerateConstruct) {
				navigator.invalidate(descendant);
				((GenerateConstruct) descendant).clearGenerated();
			}
		}
		navigator.invalidate(node);
	}
}
