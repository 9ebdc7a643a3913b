package velab.model.verilog;

import velab.util.SourceLocation;

import java.util.Objects;
import java.util.Optional;

public class AttrSpec extends VerilogNode {

	private final String key;
	private final Expression value;

	public AttrSpec(SourceLocation location, String key, Expression value) {
		super(location);
		this.key = key;
		this.value = value;
	}

	@Override
	public AttrSpec copy() {
		return new AttrSpec(getLocation(), key, value == null ? null : value.copy());
	}

	public String getKey() {
		return key;
	}

	public Optional<Expression> getValue() {
		return Optional.ofNullable(value);
	}

	@Override
	public <T, E extends Throwable> T accept(VerilogNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(key, value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		AttrSpec that = (AttrSpec) obj;
		return key.equals(that.key) && Objects.equals(value, that.value);
	}

}
