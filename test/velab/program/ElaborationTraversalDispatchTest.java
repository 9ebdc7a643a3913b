package velab.program;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import velab.analyze.Evaluator;
import velab.analyze.Navigator;
import velab.analyze.Resolver;
import velab.model.verilog.*;
import velab.scope.Scope;

import static velab.model.verilog.VerilogBuilder.*;

// each kind of item gets exactly one treatment: queued as an instantiation, queued as a generate construct,
// given its initial value, or left alone
@RunWith(Parameterized.class)
public class ElaborationTraversalDispatchTest {

	private static final long STALE = 99;

	@Parameters(name = "{0}")
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{ "instantiation", instantiate("Leaf", "u0"), 1, 0, null },
				{ "if", ifGen(num(1), block(instantiate("Leaf", "hidden"))), 0, 1, null },
				{ "case", caseGen(num(1), when(block(instantiate("Leaf", "hidden")), num(1))), 0, 1, null },
				{ "loop", loopGen("i", num(0), binop("<", ref("i"), num(2)), binop("+", ref("i"), num(1)),
						block(instantiate("Leaf", "hidden"))), 0, 1, null },
				{ "genvar", genvar("i"), 0, 0, Optional.empty() },
				{ "integer", integer("k", num(7)), 0, 0, Optional.of(7L) },
				{ "localparam", localparam("L", num(7)), 0, 0, Optional.of(7L) },
				{ "net", wire("w", num(7)), 0, 0, Optional.of(7L) },
				{ "parameter", parameter("P", num(7)), 0, 0, Optional.of(7L) },
				{ "reg", reg("r", num(7)), 0, 0, Optional.of(7L) },
				{ "port", input("a"), 0, 0, Optional.of(STALE) },
				{ "assign", assign("w", num(1)), 0, 0, null },
		});
	}

	private final ModuleItem item;
	private final int instantiations;
	private final int generates;
	private final Optional<Long> initialValue;

	public ElaborationTraversalDispatchTest(String kind, ModuleItem item, int instantiations, int generates,
	                                        Optional<Long> initialValue) {
		this.item = item;
		this.instantiations = instantiations;
		this.generates = generates;
		this.initialValue = initialValue;
	}

	@Test
	public void test() {
		if (item instanceof Declaration) {
			((Declaration) item).setInitialValue(STALE);
		}
		ModuleDeclaration md = module("M", item);
		List<Pending<ModuleInstantiation>> instantiationQueue = new ArrayList<>();
		List<Pending<GenerateConstruct>> generateQueue = new ArrayList<>();
		new ElaborationTraversalVisitor(Scope.root(md, Identifier.of("m")),
				new Evaluator(new Resolver(new Navigator())), instantiationQueue, generateQueue)
				.traverseBody(md.getItems());

		assertThat(instantiationQueue.size(), is(instantiations));
		assertThat(generateQueue.size(), is(generates));
		if (instantiations > 0) {
			assertThat(instantiationQueue.get(0).getNode(), sameInstance((ModuleItem) item));
		}
		if (generates > 0) {
			assertThat(generateQueue.get(0).getNode(), sameInstance((ModuleItem) item));
			// blocks that were never expanded are not walked
			assertFalse(((GenerateConstruct) item).isElaborated());
		}
		if (initialValue != null) {
			assertThat(((Declaration) item).getInitialValue(), is(initialValue));
		}
	}
}
