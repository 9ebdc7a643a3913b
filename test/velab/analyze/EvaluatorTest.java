package velab.analyze;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import velab.model.verilog.Declaration;
import velab.model.verilog.Expression;
import velab.model.verilog.Identifier;
import velab.model.verilog.ModuleDeclaration;
import velab.model.verilog.ModuleItem;
import velab.scope.Scope;

import static velab.model.verilog.VerilogBuilder.*;

@RunWith(Parameterized.class)
public class EvaluatorTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{ num(42), Optional.of(42L) },
				{ binop("+", num(2), num(3)), Optional.of(5L) },
				{ binop("-", num(2), num(3)), Optional.of(-1L) },
				{ binop("*", ref("WIDTH"), num(2)), Optional.of(16L) },
				{ binop("/", num(7), num(2)), Optional.of(3L) },
				{ binop("%", num(7), num(2)), Optional.of(1L) },
				{ binop("/", num(7), num(0)), Optional.empty() },
				{ binop("%", num(7), num(0)), Optional.empty() },
				{ binop("<", num(1), num(2)), Optional.of(1L) },
				{ binop(">=", num(1), num(2)), Optional.of(0L) },
				{ binop("==", ref("HALF"), num(4)), Optional.of(1L) },
				{ binop("!=", ref("HALF"), num(4)), Optional.of(0L) },
				{ binop("&&", num(1), num(0)), Optional.of(0L) },
				{ binop("||", num(1), num(0)), Optional.of(1L) },
				{ binop("&", num(6), num(3)), Optional.of(2L) },
				{ binop("|", num(6), num(3)), Optional.of(7L) },
				{ binop("^", num(6), num(3)), Optional.of(5L) },
				{ binop("<<", num(1), num(4)), Optional.of(16L) },
				{ binop(">>", num(16), num(4)), Optional.of(1L) },
				{ unop("-", num(3)), Optional.of(-3L) },
				{ unop("!", num(3)), Optional.of(0L) },
				{ unop("~", num(0)), Optional.of(-1L) },
				{ ternary(ref("WIDTH"), num(1), num(2)), Optional.of(1L) },
				{ ternary(num(0), num(1), ref("wire_value")), Optional.empty() },
				// nets are never constant, even with an initializer
				{ ref("wire_value"), Optional.empty() },
				{ ref("undeclared"), Optional.empty() },
				{ binop("+", ref("undeclared"), num(1)), Optional.empty() },
		});
	}

	private final Expression expression;
	private final Optional<Long> expected;

	private Evaluator evaluator;
	private Scope scope;

	public EvaluatorTest(Expression expression, Optional<Long> expected) {
		this.expression = expression;
		this.expected = expected;
	}

	@Before
	public void setup() {
		ModuleDeclaration m = module("m",
				parameter("WIDTH", num(8)),
				localparam("HALF", binop("/", ref("WIDTH"), num(2))),
				wire("wire_value", num(1)));
		evaluator = new Evaluator(new Resolver(new Navigator()));
		scope = Scope.root(m, Identifier.of("m"));
		for (ModuleItem item : m.getItems()) {
			evaluator.initValue((Declaration) item, scope);
		}
	}

	@Test
	public void test() {
		assertThat(evaluator.evaluate(expression, scope), is(expected));
	}

}
