package velab.analyze;

import velab.InternalCompilerError;
import velab.model.verilog.*;
import velab.scope.UID;

import java.util.*;

/**
 * Answers "which nodes does this scope introduce under this name".
 *
 * A scope node is a module body or a generate block. Its table holds the names of its own items and the labels
 * of the blocks that its expanded generate constructs produced. Tables are built on demand and kept per scope
 * node; a table whose scope has since grown is rebuilt on the next lookup.
 */
public class Navigator {

	private static final class NameTable {
		private final int shape;
		private final Map<String, List<VerilogNode>> names;

		NameTable(int shape, Map<String, List<VerilogNode>> names) {
			this.shape = shape;
			this.names = names;
		}
	}

	private final Map<UID, NameTable> tables;
	private final ItemNameVisitor itemNames;

	public Navigator() {
		this.tables = new HashMap<>();
		this.itemNames = new ItemNameVisitor();
	}

	public List<VerilogNode> lookupAll(VerilogNode scopeNode, String name) {
		List<VerilogNode> found = table(scopeNode).names.get(name);
		return found == null ? Collections.emptyList() : Collections.unmodifiableList(found);
	}

	public Optional<VerilogNode> lookup(VerilogNode scopeNode, String name) {
		List<VerilogNode> found = lookupAll(scopeNode, name);
		return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
	}

	/**
	 * Drops the table of every scope node in the given subtree. Instances attached below the subtree are left
	 * alone; they are scopes of their own.
	 */
	public void invalidate(VerilogNode subtree) {
		for (VerilogNode node : Descendants.collect(subtree, false)) {
			tables.remove(node.getUID());
		}
	}

	/**
	 * True when nothing in the given subtree has a table, that is when the subtree is unknown to this navigator
	 * or has been invalidated since its last lookup.
	 */
	public boolean isLost(VerilogNode subtree) {
		for (VerilogNode node : Descendants.collect(subtree, false)) {
			if (tables.containsKey(node.getUID())) {
				return false;
			}
		}
		return true;
	}

	private NameTable table(VerilogNode scopeNode) {
		List<ModuleItem> items = itemsOf(scopeNode);
		int shape = shapeOf(items);
		NameTable table = tables.get(scopeNode.getUID());
		if (table == null || table.shape != shape) {
			table = new NameTable(shape, build(items));
			tables.put(scopeNode.getUID(), table);
		}
		return table;
	}

	private Map<String, List<VerilogNode>> build(List<ModuleItem> items) {
		Map<String, List<VerilogNode>> names = new LinkedHashMap<>();
		for (ModuleItem item : items) {
			item.accept(itemNames).ifPresent(name -> names.computeIfAbsent(name, k -> new ArrayList<>()).add(item));
			if (item instanceof GenerateConstruct) {
				for (GenerateBlock block : ((GenerateConstruct) item).getGenerated()) {
					block.getLabel().ifPresent(
							label -> names.computeIfAbsent(label, k -> new ArrayList<>()).add(block));
				}
			}
		}
		return names;
	}

	private static int shapeOf(List<ModuleItem> items) {
		int shape = items.size();
		for (ModuleItem item : items) {
			if (item instanceof GenerateConstruct) {
				GenerateConstruct construct = (GenerateConstruct) item;
				// an expanded construct counts even when it selected nothing
				shape = 31 * shape + (construct.isElaborated() ? construct.getGenerated().size() + 1 : 0);
			}
		}
		return shape;
	}

	private static List<ModuleItem> itemsOf(VerilogNode scopeNode) {
		if (scopeNode instanceof ModuleDeclaration) {
			return ((ModuleDeclaration) scopeNode).getItems();
		} else if (scopeNode instanceof GenerateBlock) {
			return ((GenerateBlock) scopeNode).getItems();
		}
		throw new InternalCompilerError("not a scope node: " + scopeNode.getClass().getSimpleName());
	}
}
