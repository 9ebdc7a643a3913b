package velab.scope;

import velab.model.verilog.GenerateBlock;
import velab.model.verilog.Identifier;
import velab.model.verilog.ModuleDeclaration;
import velab.model.verilog.VerilogNode;

import java.util.Optional;

/**
 * An immutable chain of lexical scopes, innermost first, each paired with its hierarchical path.
 *
 * The AST has no parent pointers. Anything that needs to know where a node lives (name resolution, building
 * hierarchical instance names) receives the scope chain the node was found in instead.
 *
 * A chain starts at an instance body, whose path is the instance's full hierarchical name, or at the top of
 * the design, which has no scope node and an empty path. Generate blocks extend the chain; labelled blocks also
 * extend the path.
 */
public final class Scope {
	private final Scope parent;
	private final VerilogNode node;
	private final Identifier path;

	private Scope(Scope parent, VerilogNode node, Identifier path) {
		this.parent = parent;
		this.node = node;
		this.path = path;
	}

	public static Scope top() {
		return new Scope(null, null, Identifier.empty());
	}

	public static Scope root(ModuleDeclaration instance, Identifier path) {
		return new Scope(null, instance, path);
	}

	public Scope enter(GenerateBlock block) {
		Identifier blockPath = block.getLabel().map(path::append).orElse(path);
		return new Scope(this, block, blockPath);
	}

	public Optional<Scope> getParent() {
		return Optional.ofNullable(parent);
	}

	public Optional<VerilogNode> getNode() {
		return Optional.ofNullable(node);
	}

	public Identifier getPath() {
		return path;
	}

	@Override
	public String toString() {
		return path.isEmpty() ? "<top>" : path.toString();
	}
}
