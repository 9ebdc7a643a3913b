package velab.program;

import velab.InternalCompilerError;
import velab.analyze.HierarchyInfo;
import velab.analyze.Navigator;
import velab.analyze.Resolver;
import velab.model.verilog.GenerateBlock;
import velab.model.verilog.Identifier;
import velab.model.verilog.ModuleDeclaration;
import velab.transform.Inliner;
import velab.util.TransactionalMap;

/**
 * Inlines or outlines a whole subtree of the elaborated hierarchy. Inlining works bottom-up so that every child
 * is already flat when its parent absorbs it; outlining works top-down.
 */
public class HierarchyFlattener {

	private final TransactionalMap<Identifier, ModuleDeclaration> elaborations;
	private final HierarchyInfo hierarchyInfo;
	private final Inliner inliner;
	private final Resolver resolver;
	private final Navigator navigator;

	public HierarchyFlattener(TransactionalMap<Identifier, ModuleDeclaration> elaborations,
	                          HierarchyInfo hierarchyInfo, Inliner inliner, Resolver resolver, Navigator navigator) {
		this.elaborations = elaborations;
		this.hierarchyInfo = hierarchyInfo;
		this.inliner = inliner;
		this.resolver = resolver;
		this.navigator = navigator;
	}

	public void inlineAll(Identifier instanceId) {
		ModuleDeclaration instance = find(instanceId);
		if (!inliner.canInline(instance)) {
			return;
		}
		for (Identifier child : hierarchyInfo.getChildren(instanceId)) {
			inlineAll(child);
		}
		inliner.inlineSource(instance);
	}

	public void outlineAll(Identifier instanceId) {
		ModuleDeclaration instance = find(instanceId);
		if (!inliner.canInline(instance)) {
			return;
		}
		for (GenerateBlock block : inliner.outlineSource(instance)) {
			resolver.invalidate(block);
			navigator.invalidate(block);
		}
		for (Identifier child : hierarchyInfo.getChildren(instanceId)) {
			outlineAll(child);
		}
	}

	private ModuleDeclaration find(Identifier instanceId) {
		return elaborations.find(instanceId).orElseThrow(() -> new InternalCompilerError(
				"instance " + instanceId + " is known to the hierarchy but was never elaborated"));
	}
}
