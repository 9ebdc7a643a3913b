package velab.model.verilog;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A possibly hierarchical Verilog name, such as {@code main.blk[2].u0}.
 *
 * Identifiers are values: two identifiers with the same parts are equal. They key both the module template
 * table and the table of elaborated instances.
 */
public final class Identifier {
	private final List<String> parts;

	public Identifier(List<String> parts) {
		this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
	}

	public static Identifier of(String dotted) {
		if (dotted.isEmpty()) {
			return empty();
		}
		return new Identifier(Arrays.asList(dotted.split("\\.")));
	}

	public static Identifier empty() {
		return new Identifier(Collections.emptyList());
	}

	public List<String> getParts() {
		return parts;
	}

	public String getHead() {
		return parts.get(0);
	}

	public String getLast() {
		return parts.get(parts.size() - 1);
	}

	public int size() {
		return parts.size();
	}

	public boolean isEmpty() {
		return parts.isEmpty();
	}

	public boolean isHierarchical() {
		return parts.size() > 1;
	}

	public Identifier append(String part) {
		List<String> extended = new ArrayList<>(parts);
		extended.add(part);
		return new Identifier(extended);
	}

	public Identifier append(Identifier other) {
		List<String> extended = new ArrayList<>(parts);
		extended.addAll(other.parts);
		return new Identifier(extended);
	}

	@Override
	public int hashCode() {
		return parts.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		return parts.equals(((Identifier) obj).parts);
	}

	@Override
	public String toString() {
		return String.join(".", parts);
	}
}
