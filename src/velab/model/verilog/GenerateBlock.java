package velab.model.verilog;

import velab.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A {@code begin : label ... end} region of a generate construct. Every block opens a new scope; labelled
 * blocks also add their label to the hierarchical names of everything inside them.
 */
public class GenerateBlock extends VerilogNode {

	private final String label;
	private final List<ModuleItem> items;

	public GenerateBlock(SourceLocation location, String label, List<ModuleItem> items) {
		super(location);
		this.label = label;
		this.items = new ArrayList<>(items);
	}

	@Override
	public GenerateBlock copy() {
		return relabel(label);
	}

	/**
	 * Copies this block under a different label.
	 */
	public GenerateBlock relabel(String newLabel) {
		return new GenerateBlock(getLocation(), newLabel,
				items.stream().map(ModuleItem::copy).collect(Collectors.toList()));
	}

	public Optional<String> getLabel() {
		return Optional.ofNullable(label);
	}

	public List<ModuleItem> getItems() {
		return items;
	}

	@Override
	public <T, E extends Throwable> T accept(VerilogNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(label, items);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		GenerateBlock that = (GenerateBlock) obj;
		return Objects.equals(label, that.label) && items.equals(that.items);
	}

}
