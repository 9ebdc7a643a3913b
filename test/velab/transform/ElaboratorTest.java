package velab.transform;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.junit.Before;
import org.junit.Test;

import velab.InternalCompilerError;
import velab.analyze.Evaluator;
import velab.analyze.Navigator;
import velab.analyze.Resolver;
import velab.model.verilog.*;
import velab.scope.Scope;
import velab.util.TransactionalMap;

import static velab.model.verilog.VerilogBuilder.*;

public class ElaboratorTest {

	private TransactionalMap<Identifier, ModuleDeclaration> declarations;
	private Evaluator evaluator;
	private Elaborator elaborator;
	private ModuleDeclaration template;
	private ModuleDeclaration top;
	private Scope topScope;

	@Before
	public void setup() {
		declarations = new TransactionalMap<>();
		evaluator = new Evaluator(new Resolver(new Navigator()));
		elaborator = new Elaborator(declarations, evaluator, 8);

		template = module("child", parameter("W", num(1)), parameter("D", num(2)), reg("r"));
		declarations.checkpoint();
		declarations.insert(template.getId(), template);
		declarations.commit();

		top = module("top", parameter("N", num(4)), genvar("i"));
		topScope = Scope.root(top, Identifier.of("top"));
		evaluator.initValue((Declaration) top.getItems().get(0), topScope);
	}

	@Test
	public void testInstantiationCopiesTemplate() {
		ModuleInstantiation mi = instantiate("child", "u0");
		ModuleDeclaration instance = elaborator.elaborate(mi, topScope).get();
		assertThat(instance, is(template));
		assertThat(instance, not(sameInstance(template)));
		assertThat(mi.getInstance().get(), sameInstance(instance));
	}

	@Test
	public void testNamedParameterOverridesAreFolded() {
		ModuleInstantiation mi = instantiate("child", "u0", args(arg("D", binop("*", ref("N"), num(2)))), args());
		ModuleDeclaration instance = elaborator.elaborate(mi, topScope).get();
		assertThat(instance.getItems().get(0), is((ModuleItem) parameter("W", num(1))));
		assertThat(instance.getItems().get(1), is((ModuleItem) parameter("D", num(8))));
		// the template is untouched
		assertThat(template.getItems().get(1), is((ModuleItem) parameter("D", num(2))));
	}

	@Test
	public void testOrderedParameterOverridesAreFolded() {
		ModuleInstantiation mi = instantiate("child", "u0", args(arg(num(3)), arg(ref("N"))), args());
		ModuleDeclaration instance = elaborator.elaborate(mi, topScope).get();
		assertThat(instance.getItems().get(0), is((ModuleItem) parameter("W", num(3))));
		assertThat(instance.getItems().get(1), is((ModuleItem) parameter("D", num(4))));
	}

	@Test
	public void testInstantiationIsMemoized() {
		ModuleInstantiation mi = instantiate("child", "u0");
		ModuleDeclaration first = elaborator.elaborate(mi, topScope).get();
		assertThat(elaborator.elaborate(mi, topScope).get(), sameInstance(first));
	}

	@Test
	public void testMissingModuleIsSkipped() {
		assertThat(elaborator.elaborate(instantiate("nothing", "u0"), topScope), is(Optional.empty()));
	}

	@Test
	public void testIfSelectsBranch() {
		IfGenerateConstruct yes = ifGen(binop(">", ref("N"), num(2)), block("a", reg("x")), block("b", reg("y")));
		List<GenerateBlock> produced = elaborator.elaborate(yes, topScope);
		assertThat(produced.size(), is(1));
		assertThat(produced.get(0).getLabel(), is(Optional.of("a")));

		IfGenerateConstruct no = ifGen(num(0), block("a", reg("x")), block("b", reg("y")));
		assertThat(elaborator.elaborate(no, topScope).get(0).getLabel(), is(Optional.of("b")));
	}

	@Test
	public void testFalseIfWithoutElseProducesNothing() {
		IfGenerateConstruct gen = ifGen(num(0), block(instantiate("child", "u0")));
		assertTrue(elaborator.elaborate(gen, topScope).isEmpty());
		assertTrue(gen.isElaborated());
	}

	@Test
	public void testNonConstantConditionCountsAsFalse() {
		IfGenerateConstruct gen = ifGen(ref("nowhere"), block(reg("x")));
		assertTrue(elaborator.elaborate(gen, topScope).isEmpty());
	}

	@Test
	public void testCaseSelectsFirstMatchThenDefault() {
		CaseGenerateConstruct gen = caseGen(ref("N"),
				when(block("small", reg("s")), num(1), num(2)),
				otherwise(block("other", reg("o"))),
				when(block("four", reg("f")), num(4)));
		assertThat(elaborator.elaborate(gen, topScope).get(0).getLabel(), is(Optional.of("four")));

		CaseGenerateConstruct fallback = caseGen(num(9),
				when(block("small", reg("s")), num(1)),
				otherwise(block("other", reg("o"))));
		assertThat(elaborator.elaborate(fallback, topScope).get(0).getLabel(), is(Optional.of("other")));

		CaseGenerateConstruct none = caseGen(num(9), when(block("small", reg("s")), num(1)));
		assertTrue(elaborator.elaborate(none, topScope).isEmpty());
	}

	@Test
	public void testLoopUnrollsWithBoundGenvar() {
		LoopGenerateConstruct loop = loopGen("i", num(0), binop("<", ref("i"), ref("N")),
				binop("+", ref("i"), num(2)), block("lane", wire("w")));
		List<GenerateBlock> produced = elaborator.elaborate(loop, topScope);
		assertThat(produced.size(), is(2));
		assertThat(produced.get(0).getLabel(), is(Optional.of("lane[0]")));
		assertThat(produced.get(1).getLabel(), is(Optional.of("lane[2]")));
		assertThat(produced.get(1).getItems().get(0), is((ModuleItem) localparam("i", num(2))));
		assertThat(produced.get(1).getItems().get(1), is((ModuleItem) wire("w")));
	}

	@Test
	public void testUnlabelledLoopBodyGetsDefaultLabel() {
		LoopGenerateConstruct loop = loopGen("i", num(0), binop("<", ref("i"), num(1)),
				binop("+", ref("i"), num(1)), block(wire("w")));
		top.getItems().add(loop);
		assertThat(elaborator.elaborate(loop, topScope).get(0).getLabel(), is(Optional.of("genblk1[0]")));
	}

	@Test
	public void testLoopStopsAtIterationLimit() {
		LoopGenerateConstruct loop = loopGen("i", num(0), num(1), binop("+", ref("i"), num(1)), block(wire("w")));
		top.getItems().add(loop);
		assertThat(elaborator.elaborate(loop, topScope).size(), is(8));
	}

	@Test
	public void testUnlabelledBlocksAreNumberedByConstructPosition() {
		IfGenerateConstruct first = ifGen(num(1), block(reg("a")));
		CaseGenerateConstruct second = caseGen(ref("N"), otherwise(block(reg("b"))));
		IfGenerateConstruct labelled = ifGen(num(1), block("named", reg("c")));
		IfGenerateConstruct fourth = ifGen(num(0), block("unused", reg("d")), block(reg("e")));
		top.getItems().addAll(Arrays.asList(first, wire("between"), second, labelled, fourth));

		assertThat(elaborator.elaborate(first, topScope).get(0).getLabel(), is(Optional.of("genblk1")));
		assertThat(elaborator.elaborate(second, topScope).get(0).getLabel(), is(Optional.of("genblk2")));
		assertThat(elaborator.elaborate(labelled, topScope).get(0).getLabel(), is(Optional.of("named")));
		assertThat(elaborator.elaborate(fourth, topScope).get(0).getLabel(), is(Optional.of("genblk4")));
	}

	@Test(expected = InternalCompilerError.class)
	public void testUnlabelledBlockOutsideItsScope() {
		elaborator.elaborate(ifGen(num(1), block(reg("a"))), topScope);
	}
}
