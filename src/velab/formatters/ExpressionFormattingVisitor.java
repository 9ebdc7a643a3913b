package velab.formatters;

import velab.model.verilog.*;

import java.io.IOException;

public class ExpressionFormattingVisitor extends ExpressionVisitor<Void, IOException> {
	private final IndentingWriter out;

	public ExpressionFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(NumberLiteral numberLiteral) throws IOException {
		out.write(Long.toString(numberLiteral.getValue()));
		return null;
	}

	@Override
	public Void visit(Reference reference) throws IOException {
		out.write(reference.getId().toString());
		return null;
	}

	@Override
	public Void visit(UnaryExpression unaryExpression) throws IOException {
		out.write(unaryExpression.getOperator());
		out.write("(");
		unaryExpression.getOperand().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(BinaryExpression binaryExpression) throws IOException {
		out.write("(");
		binaryExpression.getLHS().accept(this);
		out.write(" ");
		out.write(binaryExpression.getOperator());
		out.write(" ");
		binaryExpression.getRHS().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ConditionalExpression conditionalExpression) throws IOException {
		out.write("(");
		conditionalExpression.getCondition().accept(this);
		out.write(" ? ");
		conditionalExpression.getYes().accept(this);
		out.write(" : ");
		conditionalExpression.getNo().accept(this);
		out.write(")");
		return null;
	}
}
