package velab.model.verilog;

import velab.util.SourceLocation;

import java.util.Objects;

public class UnaryExpression extends Expression {

	private final String operator;
	private final Expression operand;

	public UnaryExpression(SourceLocation location, String operator, Expression operand) {
		super(location);
		this.operator = operator;
		this.operand = operand;
	}

	@Override
	public UnaryExpression copy() {
		return new UnaryExpression(getLocation(), operator, operand.copy());
	}

	public String getOperator() {
		return operator;
	}

	public Expression getOperand() {
		return operand;
	}

	@Override
	public <T, E extends Throwable> T accept(ExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, operand);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		UnaryExpression that = (UnaryExpression) obj;
		return operator.equals(that.operator) && operand.equals(that.operand);
	}

}
