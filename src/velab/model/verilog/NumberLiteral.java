package velab.model.verilog;

import velab.util.SourceLocation;

public class NumberLiteral extends Expression {

	private final long value;

	public NumberLiteral(SourceLocation location, long value) {
		super(location);
		this.value = value;
	}

	@Override
	public NumberLiteral copy() {
		return new NumberLiteral(getLocation(), value);
	}

	public long getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(ExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Long.hashCode(value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		return value == ((NumberLiteral) obj).value;
	}

}
