package velab.program;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import org.junit.Before;
import org.junit.Test;

import velab.InternalCompilerError;
import velab.analyze.HierarchyInfo;
import velab.analyze.Navigator;
import velab.analyze.Resolver;
import velab.errors.TopLevelIssueContext;
import velab.model.verilog.*;
import velab.transform.Inliner;
import velab.util.TransactionalMap;

import static velab.model.verilog.VerilogBuilder.*;

public class HierarchyFlattenerTest {

	private Program program;

	@Before
	public void setup() {
		program = new Program();
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		program.declare(module("Leaf", input("a"), output("y"), wire("t", ref("a")), assign("y", ref("t"))), ctx);
		program.declare(module("Mid", input("i"), output("o"),
				instantiate("Leaf", "l0", arg("a", ref("i")), arg("y", ref("o")))), ctx);
		program.declare(module("Top", wire("p"), wire("q"),
				instantiate("Mid", "u0", arg("i", ref("p")), arg("o", ref("q")))), ctx);
		assertTrue(program.eval(instantiate("Top", "top"), ctx));
	}

	private ModuleInstantiation instantiation(String instanceId, int index) {
		return (ModuleInstantiation) program.getElaboration(Identifier.of(instanceId)).get().getItems().get(index);
	}

	@Test
	public void testInlineThenOutline() {
		TopLevelIssueContext before = new TopLevelIssueContext();
		assertTrue(program.check(before));

		program.inlineAll();
		assertTrue(instantiation("top", 2).isInlined());
		assertTrue(instantiation("top.u0", 2).isInlined());
		TopLevelIssueContext inlined = new TopLevelIssueContext();
		assertTrue(program.check(inlined));

		program.outlineAll();
		assertFalse(instantiation("top", 2).isInlined());
		assertFalse(instantiation("top.u0", 2).isInlined());
		TopLevelIssueContext after = new TopLevelIssueContext();
		assertTrue(program.check(after));

		assertThat(after.getIssues(), is(before.getIssues()));
		assertThat(after.getWarnings(), is(before.getWarnings()));
	}

	@Test
	public void testStdModulesStayOutlined() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		Program p = new Program();
		p.declare(module("Base", reg("r")), ctx);
		p.declare(module("Prim", attrs(attr(Inliner.STD_ATTRIBUTE)), input("a")), ctx);
		p.declare(module("Top", wire("w"), instantiate("Prim", "u0", arg("a", ref("w")))), ctx);
		assertTrue(p.eval(instantiate("Top", "top"), ctx));

		p.inlineAll();
		ModuleInstantiation mi = (ModuleInstantiation) p.getRootInstance().get().getItems().get(1);
		assertFalse(mi.isInlined());
	}

	@Test(expected = InternalCompilerError.class)
	public void testChildMissingFromInstanceTable() {
		ModuleInstantiation mi = instantiate("Leaf", "u0");
		mi.setInstance(module("Leaf", reg("r")));
		ModuleDeclaration top = module("Top", mi);

		TransactionalMap<Identifier, ModuleDeclaration> elaborations = new TransactionalMap<>();
		elaborations.checkpoint();
		elaborations.insert(Identifier.of("top"), top);
		elaborations.commit();
		Navigator navigator = new Navigator();
		new HierarchyFlattener(elaborations, new HierarchyInfo(elaborations), new Inliner(),
				new Resolver(navigator), navigator).inlineAll(Identifier.of("top"));
	}
}
