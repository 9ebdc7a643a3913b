package velab.model.verilog;

import velab.util.SourceLocation;

import java.util.Objects;

public class PortDeclaration extends Declaration {

	public enum Direction {
		INPUT,
		OUTPUT,
	}

	private final Direction direction;

	public PortDeclaration(SourceLocation location, Direction direction, String name) {
		super(location, name, null);
		this.direction = direction;
	}

	@Override
	public PortDeclaration copy() {
		return new PortDeclaration(getLocation(), direction, getName());
	}

	public Direction getDirection() {
		return direction;
	}

	@Override
	public <T, E extends Throwable> T accept(ModuleItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(super.hashCode(), direction);
	}

	@Override
	public boolean equals(Object obj) {
		return super.equals(obj) && direction == ((PortDeclaration) obj).direction;
	}

}
