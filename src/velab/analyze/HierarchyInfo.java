package velab.analyze;

import velab.model.verilog.*;
import velab.scope.Scope;
import velab.util.TransactionalMap;

import java.util.*;

/**
 * Parent/child structure of the elaborated hierarchy, derived on demand from the elaborated instances and
 * cached per instance name. Dropping an instance's entry is constant time; it is recomputed on the next query.
 */
public class HierarchyInfo {

	private final TransactionalMap<Identifier, ModuleDeclaration> elaborations;
	private final Map<Identifier, List<Identifier>> children;

	public HierarchyInfo(TransactionalMap<Identifier, ModuleDeclaration> elaborations) {
		this.elaborations = elaborations;
		this.children = new HashMap<>();
	}

	/**
	 * The full names of the instances elaborated directly below the named instance, in body order. Unknown
	 * instances have no children.
	 */
	public List<Identifier> getChildren(Identifier instanceId) {
		List<Identifier> cached = children.get(instanceId);
		if (cached != null) {
			return cached;
		}
		Optional<ModuleDeclaration> instance = elaborations.find(instanceId);
		if (!instance.isPresent()) {
			return Collections.emptyList();
		}
		List<Identifier> found = new ArrayList<>();
		collect(instance.get().getItems(), Scope.root(instance.get(), instanceId), found);
		List<Identifier> result = Collections.unmodifiableList(found);
		children.put(instanceId, result);
		return result;
	}

	public void invalidate(Identifier instanceId) {
		children.remove(instanceId);
	}

	public boolean isCached(Identifier instanceId) {
		return children.containsKey(instanceId);
	}

	private static void collect(List<ModuleItem> items, Scope scope, List<Identifier> found) {
		for (ModuleItem item : items) {
			if (item instanceof ModuleInstantiation) {
				ModuleInstantiation mi = (ModuleInstantiation) item;
				if (mi.getInstance().isPresent()) {
					found.add(scope.getPath().append(mi.getInstanceName()));
				}
			} else if (item instanceof GenerateConstruct) {
				for (GenerateBlock block : ((GenerateConstruct) item).getGenerated()) {
					collect(block.getItems(), scope.enter(block), found);
				}
			}
		}
	}
}
