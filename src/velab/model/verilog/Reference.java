package velab.model.verilog;

import velab.util.SourceLocation;

/**
 * A use of a name inside an expression, possibly hierarchical ({@code u0.count}).
 */
public class Reference extends Expression {

	private final Identifier id;

	public Reference(SourceLocation location, Identifier id) {
		super(location);
		this.id = id;
	}

	@Override
	public Reference copy() {
		return new Reference(getLocation(), id);
	}

	public Identifier getId() {
		return id;
	}

	@Override
	public <T, E extends Throwable> T accept(ExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return id.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		return id.equals(((Reference) obj).id);
	}

}
