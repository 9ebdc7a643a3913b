package velab.model.verilog;

import velab.util.SourceLocation;

import java.util.Objects;

public class BinaryExpression extends Expression {

	private final String operator;
	private final Expression lhs;
	private final Expression rhs;

	public BinaryExpression(SourceLocation location, String operator, Expression lhs, Expression rhs) {
		super(location);
		this.operator = operator;
		this.lhs = lhs;
		this.rhs = rhs;
	}

	@Override
	public BinaryExpression copy() {
		return new BinaryExpression(getLocation(), operator, lhs.copy(), rhs.copy());
	}

	public String getOperator() {
		return operator;
	}

	public Expression getLHS() {
		return lhs;
	}

	public Expression getRHS() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(ExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, lhs, rhs);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		BinaryExpression that = (BinaryExpression) obj;
		return operator.equals(that.operator) && lhs.equals(that.lhs) && rhs.equals(that.rhs);
	}

}
