package velab.model.verilog;

import velab.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A module definition. Declared modules act as templates; elaborated instances are copies of a template with
 * parameter overrides applied, and share this representation.
 */
public class ModuleDeclaration extends VerilogNode {

	private Attributes attributes;
	private final Identifier id;
	private final List<ModuleItem> items;

	public ModuleDeclaration(SourceLocation location, Attributes attributes, Identifier id, List<ModuleItem> items) {
		super(location);
		this.attributes = attributes;
		this.id = id;
		this.items = new ArrayList<>(items);
	}

	@Override
	public ModuleDeclaration copy() {
		return new ModuleDeclaration(getLocation(), attributes.copy(), id,
				items.stream().map(ModuleItem::copy).collect(Collectors.toList()));
	}

	public Attributes getAttributes() {
		return attributes;
	}

	public void replaceAttributes(Attributes attributes) {
		this.attributes = attributes;
	}

	public Identifier getId() {
		return id;
	}

	/**
	 * @return the mutable item list; items appended here become part of the module
	 */
	public List<ModuleItem> getItems() {
		return items;
	}

	@Override
	public <T, E extends Throwable> T accept(VerilogNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(attributes, id, items);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		ModuleDeclaration that = (ModuleDeclaration) obj;
		return attributes.equals(that.attributes) && id.equals(that.id) && items.equals(that.items);
	}

}
