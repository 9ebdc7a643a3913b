package velab.program;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Collections;
import java.util.Optional;

import org.junit.Before;
import org.junit.Test;

import velab.ElaborationOptions;
import velab.check.InstantiationDepthIssue;
import velab.check.InvalidAssignmentTargetIssue;
import velab.check.NameConflictIssue;
import velab.errors.IssueWithContext;
import velab.errors.TopLevelIssueContext;
import velab.model.verilog.*;

import static velab.model.verilog.VerilogBuilder.*;

public class ProgramTest {

	private Program program;
	private TopLevelIssueContext ctx;

	@Before
	public void setup() {
		program = new Program();
		ctx = new TopLevelIssueContext();
	}

	private ModuleDeclaration root() {
		return program.getRootInstance().get();
	}

	@Test
	public void testDuplicateDeclaration() {
		assertTrue(program.declare(module("M", reg("r")), ctx));
		assertFalse(program.declare(module("M", wire("w")), ctx));
		assertThat(program.declarationCount(), is(1));
		assertThat(ctx.getIssues().size(), is(1));
		IssueWithContext issue = (IssueWithContext) ctx.getIssues().get(0);
		assertThat(issue.getContext(), instanceOf(WhileDeclaringModule.class));
		assertThat(issue.getIssue(), instanceOf(DuplicateDeclarationIssue.class));
	}

	@Test
	public void testFirstDeclarationIsRoot() {
		ModuleDeclaration a = module("A", reg("r"));
		ModuleDeclaration b = module("B", reg("r"));
		program.declare(a, ctx);
		program.declare(b, ctx);
		assertThat(program.getRootDeclaration().get(), sameInstance(a));
		assertThat(program.getLastDeclaration().get(), sameInstance(b));
	}

	@Test
	public void testInvalidTemplateIsNotDeclared() {
		assertFalse(program.declare(module("M", wire("w", ref("missing"))), ctx));
		assertThat(program.declarationCount(), is(0));
		assertFalse(program.getRootDeclaration().isPresent());
	}

	@Test
	public void testHierarchicalNamesOnlyWarnWhileDeclaring() {
		assertTrue(program.declare(module("M", wire("w", ref("u0.q"))), ctx));
		assertFalse(ctx.hasErrors());
		assertThat(ctx.getWarnings().size(), is(1));
	}

	@Test
	public void testEvalBeforeAnyDeclaration() {
		assertFalse(program.eval(instantiate("M", "m"), ctx));
		assertThat(ctx.getIssues().get(0), instanceOf(NoRootDeclarationIssue.class));
		assertThat(program.declarationCount(), is(0));
		assertThat(program.elaborationCount(), is(0));
	}

	@Test
	public void testRootMustInstantiateLatestDeclaration() {
		program.declare(module("A", reg("r")), ctx);
		program.declare(module("B", reg("r")), ctx);

		assertFalse(program.eval(instantiate("A", "a"), ctx));
		assertThat(ctx.getIssues().get(0), instanceOf(RootInstantiationMismatchIssue.class));
		assertFalse(program.eval(reg("x"), ctx));
		assertThat(program.elaborationCount(), is(0));
		assertFalse(program.getRootInstantiation().isPresent());

		assertTrue(program.eval(instantiate("B", "b"), ctx));
		assertThat(program.getRootId(), is(Optional.of(Identifier.of("b"))));
	}

	@Test
	public void testDeclareAndInstantiate() {
		assertTrue(program.declareAndInstantiate(module("Main", reg("r")), ctx));
		assertThat(program.elaborationCount(), is(1));
		assertTrue(program.getElaboration(Identifier.of("main")).isPresent());
		assertThat(root().getItems().get(0), is((ModuleItem) reg("r")));
	}

	@Test
	public void testSelfInstantiationUnderFalseConditionIsNotExpanded() {
		ModuleDeclaration m = module("M",
				reg("r"),
				ifGen(num(0), block(instantiate("M", "inner"))));
		assertTrue(program.declareAndInstantiate(m, ctx));
		assertFalse(ctx.hasErrors());
		assertThat(program.elaborationCount(), is(1));

		IfGenerateConstruct gen = (IfGenerateConstruct) root().getItems().get(1);
		assertTrue(gen.isElaborated());
		assertTrue(gen.getGenerated().isEmpty());
	}

	@Test
	public void testUnboundedRecursionHitsDepthLimit() {
		ModuleDeclaration m = module("M", ifGen(num(1), block(instantiate("M", "inner"))));
		assertTrue(program.declare(m, ctx));
		assertFalse(program.eval(instantiate("M", "m"), ctx));
		assertThat(ctx.getIssues().get(0), instanceOf(InstantiationDepthIssue.class));
		assertThat(program.elaborationCount(), is(0));
	}

	@Test
	public void testNestedInstancesAreElaborated() {
		program.declare(module("Child", parameter("W", num(1)), input("a"), output("y"), assign("y", ref("a"))), ctx);
		program.declare(module("Top", wire("p"), wire("q"),
				instantiate("Child", "u0", args(arg("W", num(4))), args(arg("a", ref("p")), arg("y", ref("q"))))),
				ctx);
		assertTrue(program.eval(instantiate("Top", "top"), ctx));

		assertThat(program.elaborationCount(), is(2));
		ModuleDeclaration u0 = program.getElaboration(Identifier.of("top.u0")).get();
		assertThat(((Declaration) u0.getItems().get(0)).getInitialValue(), is(Optional.of(4L)));
		assertThat(program.getHierarchyInfo().getChildren(Identifier.of("top")),
				is(Collections.singletonList(Identifier.of("top.u0"))));
	}

	@Test
	public void testLoopGeneratedInstances() {
		program.declare(module("Leaf", reg("r")), ctx);
		program.declare(module("Top", genvar("i"),
				loopGen("i", num(0), binop("<", ref("i"), num(3)), binop("+", ref("i"), num(1)),
						block("lane", instantiate("Leaf", "u")))), ctx);
		assertTrue(program.eval(instantiate("Top", "top"), ctx));
		assertThat(program.elaborationCount(), is(4));
		assertTrue(program.getElaboration(Identifier.of("top.lane[2].u")).isPresent());
		assertTrue(program.check(ctx));
	}

	@Test
	public void testUnlabelledGenerateBlocksGetDistinctNames() {
		program.declare(module("Leaf", reg("r")), ctx);
		program.declare(module("Top", genvar("i"),
				loopGen("i", num(0), binop("<", ref("i"), num(2)), binop("+", ref("i"), num(1)),
						block(instantiate("Leaf", "u"))),
				loopGen("i", num(0), binop("<", ref("i"), num(1)), binop("+", ref("i"), num(1)),
						block(instantiate("Leaf", "u"))),
				ifGen(num(1), block(instantiate("Leaf", "u")))), ctx);
		assertTrue(program.eval(instantiate("Top", "top"), ctx));
		assertFalse(ctx.hasErrors());

		assertThat(program.elaborationCount(), is(5));
		assertTrue(program.getElaboration(Identifier.of("top.genblk1[0].u")).isPresent());
		assertTrue(program.getElaboration(Identifier.of("top.genblk1[1].u")).isPresent());
		assertTrue(program.getElaboration(Identifier.of("top.genblk2[0].u")).isPresent());
		assertTrue(program.getElaboration(Identifier.of("top.genblk3.u")).isPresent());
	}

	private void declareModeSwitch(Program target) {
		target.declare(module("Leaf", reg("r")), ctx);
		target.declare(module("Top", parameter("MODE", num(2)),
				caseGen(ref("MODE"),
						when(block("narrow", instantiate("Leaf", "u")), num(1)),
						when(block("wide", instantiate("Leaf", "u")), num(2)),
						otherwise(block(instantiate("Leaf", "u"))))), ctx);
	}

	@Test
	public void testCaseGenerateSelectsByParameter() {
		declareModeSwitch(program);
		assertTrue(program.eval(instantiate("Top", "top"), ctx));
		assertThat(program.elaborationCount(), is(2));
		assertTrue(program.getElaboration(Identifier.of("top.wide.u")).isPresent());
		assertFalse(program.getElaboration(Identifier.of("top.narrow.u")).isPresent());

		Program overridden = new Program();
		declareModeSwitch(overridden);
		assertTrue(overridden.eval(instantiate("Top", "top", args(arg("MODE", num(7))), args()), ctx));
		assertThat(overridden.elaborationCount(), is(2));
		assertTrue(overridden.getElaboration(Identifier.of("top.genblk1.u")).isPresent());
		assertFalse(ctx.hasErrors());
	}

	@Test
	public void testDeclaredModulesInheritRootAttributes() {
		program.declare(module("A", attrs(attr("keep", num(1))), reg("r")), ctx);
		ModuleDeclaration b = module("B", reg("r"));
		program.declare(b, ctx);
		assertTrue(b.getAttributes().find("keep").isPresent());
	}

	@Test
	public void testInstancesInheritRootInstantiationAttributes() {
		program.declare(module("Child", reg("r")), ctx);
		program.declare(module("Top", instantiate("Child", "u0")), ctx);
		assertTrue(program.eval(instantiate(attrs(attr("clock", num(5))), "Top", "top", args(), args()), ctx));

		assertTrue(root().getAttributes().find("clock").isPresent());
		assertFalse(program.getElaboration(Identifier.of("top.u0")).get().getAttributes().find("clock").isPresent());

		assertTrue(program.eval(instantiate("Child", "u1"), ctx));
		assertTrue(program.eval(instantiate(attrs(attr("own")), "Child", "u2", args(), args()), ctx));
		Attributes u1 = program.getElaboration(Identifier.of("top.u1")).get().getAttributes();
		assertTrue(u1.find("clock").isPresent());
		Attributes u2 = program.getElaboration(Identifier.of("top.u2")).get().getAttributes();
		assertTrue(u2.find("own").isPresent());
		assertFalse(u2.find("clock").isPresent());
	}

	@Test
	public void testEvalItemAppendsToRoot() {
		program.declare(module("Child", reg("r")), ctx);
		program.declareAndInstantiate(module("Main", wire("w")), ctx);
		int before = root().getItems().size();

		assertTrue(program.eval(wire("x", ref("w")), ctx));
		assertTrue(program.eval(instantiate("Child", "u1"), ctx));
		assertThat(root().getItems().size(), is(before + 2));
		assertThat(program.elaborationCount(), is(2));
		assertThat(program.getHierarchyInfo().getChildren(Identifier.of("main")),
				is(Collections.singletonList(Identifier.of("main.u1"))));
	}

	@Test
	public void testFailedEvalItemRestoresRoot() {
		program.declareAndInstantiate(module("Main", reg("r"), wire("w")), ctx);
		program.eval(wire("x1"), ctx);
		program.eval(wire("x2"), ctx);
		int size = root().getItems().size();

		Reference source = ref("x1");
		ContinuousAssign bad = new ContinuousAssign(source.getLocation(), ref("r"), source);
		assertFalse(program.eval(bad, ctx));
		assertThat(ctx.getIssues().get(0), instanceOf(InvalidAssignmentTargetIssue.class));
		assertThat(root().getItems().size(), is(size));
		assertFalse(program.getResolver().isCached(source));
		assertTrue(program.getNavigator().isLost(root()));

		assertTrue(program.eval(assign("w", ref("x1")), ctx));
		assertThat(root().getItems().size(), is(size + 1));
	}

	@Test
	public void testRejectedItemCanBeSubmittedAgain() {
		program.declareAndInstantiate(module("Main", reg("r")), ctx);
		NetDeclaration early = wire("early", ref("later"));
		assertFalse(program.eval(early, ctx));
		assertTrue(program.eval(wire("later"), ctx));

		TopLevelIssueContext retry = new TopLevelIssueContext();
		assertTrue(program.eval(early, retry));
		assertFalse(retry.hasErrors());
	}

	@Test
	public void testFailedInstantiationIsRolledBack() {
		program.declare(module("Broken", wire("w", ref("nowhere.x"))), ctx);
		program.declareAndInstantiate(module("Main", reg("r")), ctx);
		assertThat(program.elaborationCount(), is(1));

		ModuleInstantiation mi = instantiate("Broken", "b0");
		assertFalse(program.eval(mi, ctx));
		assertThat(program.elaborationCount(), is(1));
		assertFalse(program.getElaboration(Identifier.of("main.b0")).isPresent());
		assertFalse(mi.getInstance().isPresent());
		assertThat(root().getItems().size(), is(1));
	}

	@Test
	public void testInstanceNameConflict() {
		program.declare(module("Child", reg("r")), ctx);
		program.declareAndInstantiate(module("Main", instantiate("Child", "u0")), ctx);
		assertFalse(program.eval(instantiate("Child", "u0"), ctx));
		assertThat(ctx.getIssues().get(0), instanceOf(NameConflictIssue.class));
		assertThat(program.elaborationCount(), is(2));
	}

	@Test
	public void testTypecheckOff() {
		program.declareAndInstantiate(module("Main", reg("r")), ctx);
		assertFalse(program.eval(wire("w", ref("missing")), ctx));
		program.typecheck(false);
		assertTrue(program.eval(wire("w", ref("missing")), new TopLevelIssueContext()));
	}

	@Test
	public void testConstructorsDeclareAndEvaluate() {
		Program instantiated = new Program(new ElaborationOptions(), module("Main", reg("r")), ctx);
		assertThat(instantiated.getRootId(), is(Optional.of(Identifier.of("main"))));

		Program evaluated = new Program(new ElaborationOptions(), module("Main", reg("r")),
				instantiate("Main", "dut"), ctx);
		assertThat(evaluated.getRootId(), is(Optional.of(Identifier.of("dut"))));
		assertFalse(ctx.hasErrors());
	}
}
