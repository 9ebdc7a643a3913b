package velab.analyze;

import velab.model.verilog.*;
import velab.scope.Scope;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Folds constant expressions over 64-bit integers.
 *
 * Constants are number literals, parameters and localparams whose initial value has been computed, and loop
 * variables bound by the caller. Anything else, including division by zero, makes the expression non-constant.
 */
public class Evaluator {

	private final Resolver resolver;

	public Evaluator(Resolver resolver) {
		this.resolver = resolver;
	}

	/**
	 * Computes and stores the initial value of a declaration. The value is left unset when the declaration has
	 * no initializer or the initializer is not constant.
	 */
	public void initValue(Declaration declaration, Scope scope) {
		declaration.clearInitialValue();
		declaration.getValue()
				.flatMap(value -> evaluate(value, scope))
				.ifPresent(declaration::setInitialValue);
	}

	public Optional<Long> evaluate(Expression expression, Scope scope) {
		return evaluate(expression, scope, Collections.emptyMap());
	}

	public Optional<Long> evaluate(Expression expression, Scope scope, Map<String, Long> bindings) {
		return expression.accept(new EvaluationVisitor(scope, bindings));
	}

	public boolean isConstant(Expression expression, Scope scope) {
		return evaluate(expression, scope).isPresent();
	}

	private class EvaluationVisitor extends ExpressionVisitor<Optional<Long>, RuntimeException> {
		private final Scope scope;
		private final Map<String, Long> bindings;

		EvaluationVisitor(Scope scope, Map<String, Long> bindings) {
			this.scope = scope;
			this.bindings = bindings;
		}

		@Override
		public Optional<Long> visit(NumberLiteral numberLiteral) {
			return Optional.of(numberLiteral.getValue());
		}

		@Override
		public Optional<Long> visit(Reference reference) {
			Identifier id = reference.getId();
			if (!id.isHierarchical() && bindings.containsKey(id.getHead())) {
				return Optional.of(bindings.get(id.getHead()));
			}
			Optional<Declaration> target = resolver.resolve(reference, scope, false);
			if (!target.isPresent()) {
				return Optional.empty();
			}
			Declaration declaration = target.get();
			if (declaration instanceof ParameterDeclaration || declaration instanceof LocalparamDeclaration) {
				return declaration.getInitialValue();
			}
			return Optional.empty();
		}

		@Override
		public Optional<Long> visit(UnaryExpression unaryExpression) {
			Optional<Long> operand = unaryExpression.getOperand().accept(this);
			if (!operand.isPresent()) {
				return Optional.empty();
			}
			long v = operand.get();
			switch (unaryExpression.getOperator()) {
				case "-":
					return Optional.of(-v);
				case "+":
					return Optional.of(v);
				case "!":
					return Optional.of(v == 0 ? 1L : 0L);
				case "~":
					return Optional.of(~v);
				default:
					return Optional.empty();
			}
		}

		@Override
		public Optional<Long> visit(BinaryExpression binaryExpression) {
			Optional<Long> lhs = binaryExpression.getLHS().accept(this);
			Optional<Long> rhs = binaryExpression.getRHS().accept(this);
			if (!lhs.isPresent() || !rhs.isPresent()) {
				return Optional.empty();
			}
			long l = lhs.get();
			long r = rhs.get();
			switch (binaryExpression.getOperator()) {
				case "+":
					return Optional.of(l + r);
				case "-":
					return Optional.of(l - r);
				case "*":
					return Optional.of(l * r);
				case "/":
					return r == 0 ? Optional.empty() : Optional.of(l / r);
				case "%":
					return r == 0 ? Optional.empty() : Optional.of(l % r);
				case "==":
					return truth(l == r);
				case "!=":
					return truth(l != r);
				case "<":
					return truth(l < r);
				case "<=":
					return truth(l <= r);
				case ">":
					return truth(l > r);
				case ">=":
					return truth(l >= r);
				case "&&":
					return truth(l != 0 && r != 0);
				case "||":
					return truth(l != 0 || r != 0);
				case "&":
					return Optional.of(l & r);
				case "|":
					return Optional.of(l | r);
				case "^":
					return Optional.of(l ^ r);
				case "<<":
					return Optional.of(r < 0 || r >= 64 ? 0L : l << r);
				case ">>":
					return Optional.of(r < 0 || r >= 64 ? 0L : l >>> r);
				default:
					return Optional.empty();
			}
		}

		@Override
		public Optional<Long> visit(ConditionalExpression conditionalExpression) {
			Optional<Long> condition = conditionalExpression.getCondition().accept(this);
			if (!condition.isPresent()) {
				return Optional.empty();
			}
			return condition.get() != 0
					? conditionalExpression.getYes().accept(this)
					: conditionalExpression.getNo().accept(this);
		}

		private Optional<Long> truth(boolean b) {
			return Optional.of(b ? 1L : 0L);
		}
	}
}
