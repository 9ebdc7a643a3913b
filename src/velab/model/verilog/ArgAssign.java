package velab.model.verilog;

import velab.util.SourceLocation;

import java.util.Objects;
import java.util.Optional;

/**
 * A parameter or port binding of an instantiation, either ordered ({@code (x)}) or named ({@code .p(x)}).
 */
public class ArgAssign extends VerilogNode {

	private final String name;
	private final Expression value;

	public ArgAssign(SourceLocation location, String name, Expression value) {
		super(location);
		this.name = name;
		this.value = value;
	}

	@Override
	public ArgAssign copy() {
		return new ArgAssign(getLocation(), name, value.copy());
	}

	public Optional<String> getName() {
		return Optional.ofNullable(name);
	}

	public boolean isNamed() {
		return name != null;
	}

	public Expression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(VerilogNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		ArgAssign that = (ArgAssign) obj;
		return Objects.equals(name, that.name) && value.equals(that.value);
	}

}
