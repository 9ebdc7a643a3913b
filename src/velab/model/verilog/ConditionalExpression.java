package velab.model.verilog;

import velab.util.SourceLocation;

import java.util.Objects;

public class ConditionalExpression extends Expression {

	private final Expression condition;
	private final Expression yes;
	private final Expression no;

	public ConditionalExpression(SourceLocation location, Expression condition, Expression yes, Expression no) {
		super(location);
		this.condition = condition;
		this.yes = yes;
		this.no = no;
	}

	@Override
	public ConditionalExpression copy() {
		return new ConditionalExpression(getLocation(), condition.copy(), yes.copy(), no.copy());
	}

	public Expression getCondition() {
		return condition;
	}

	public Expression getYes() {
		return yes;
	}

	public Expression getNo() {
		return no;
	}

	@Override
	public <T, E extends Throwable> T accept(ExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, yes, no);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		ConditionalExpression that = (ConditionalExpression) obj;
		return condition.equals(that.condition) && yes.equals(that.yes) && no.equals(that.no);
	}

}
