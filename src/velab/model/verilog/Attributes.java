package velab.model.verilog;

import velab.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The {@code (* key = value, ... *)} annotation list attached to modules and instantiations.
 */
public class Attributes extends VerilogNode {

	private final List<AttrSpec> specs;

	public Attributes(SourceLocation location, List<AttrSpec> specs) {
		super(location);
		this.specs = new ArrayList<>(specs);
	}

	@Override
	public Attributes copy() {
		return new Attributes(getLocation(), specs.stream().map(AttrSpec::copy).collect(Collectors.toList()));
	}

	public List<AttrSpec> getSpecs() {
		return specs;
	}

	public boolean isEmpty() {
		return specs.isEmpty();
	}

	public Optional<AttrSpec> find(String key) {
		return specs.stream().filter(s -> s.getKey().equals(key)).findFirst();
	}

	/**
	 * Copies every spec of {@code other} into this list, replacing specs that share a key.
	 */
	public void setOrReplace(Attributes other) {
		for (AttrSpec spec : other.specs) {
			AttrSpec replacement = spec.copy();
			boolean replaced = false;
			for (int i = 0; i < specs.size(); ++i) {
				if (specs.get(i).getKey().equals(spec.getKey())) {
					specs.set(i, replacement);
					replaced = true;
					break;
				}
			}
			if (!replaced) {
				specs.add(replacement);
			}
		}
	}

	@Override
	public <T, E extends Throwable> T accept(VerilogNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return specs.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		return specs.equals(((Attributes) obj).specs);
	}

}
