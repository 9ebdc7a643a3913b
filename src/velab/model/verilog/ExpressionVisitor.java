package velab.model.verilog;

public abstract class ExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(NumberLiteral numberLiteral) throws E;
	public abstract T visit(Reference reference) throws E;
	public abstract T visit(UnaryExpression unaryExpression) throws E;
	public abstract T visit(BinaryExpression binaryExpression) throws E;
	public abstract T visit(ConditionalExpression conditionalExpression) throws E;
}
