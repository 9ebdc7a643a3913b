package velab.analyze;

import velab.model.verilog.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists the references an expression mentions, left to right.
 */
public class References extends ExpressionVisitor<Void, RuntimeException> {

	private final List<Reference> found;

	private References() {
		this.found = new ArrayList<>();
	}

	public static List<Reference> in(Expression expression) {
		References refs = new References();
		expression.accept(refs);
		return refs.found;
	}

	@Override
	public Void visit(NumberLiteral numberLiteral) {
		return null;
	}

	@Override
	public Void visit(Reference reference) {
		found.add(reference);
		return null;
	}

	@Override
	public Void visit(UnaryExpression unaryExpression) {
		unaryExpression.getOperand().accept(this);
		return null;
	}

	@Override
	public Void visit(BinaryExpression binaryExpression) {
		binaryExpression.getLHS().accept(this);
		binaryExpression.getRHS().accept(this);
		return null;
	}

	@Override
	public Void visit(ConditionalExpression conditionalExpression) {
		conditionalExpression.getCondition().accept(this);
		conditionalExpression.getYes().accept(this);
		conditionalExpression.getNo().accept(this);
		return null;
	}
}
