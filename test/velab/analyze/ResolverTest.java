package velab.analyze;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Collections;

import org.junit.Before;
import org.junit.Test;

import velab.model.verilog.*;
import velab.scope.Scope;

import static velab.model.verilog.VerilogBuilder.*;

public class ResolverTest {

	private Resolver resolver;

	private RegDeclaration outer;
	private RegDeclaration inner;
	private RegDeclaration childReg;
	private ModuleDeclaration child;
	private ModuleInstantiation u0;
	private GenerateBlock produced;
	private ModuleDeclaration top;
	private Scope topScope;

	@Before
	public void setup() {
		resolver = new Resolver(new Navigator());

		childReg = reg("q");
		child = module("child", childReg);
		u0 = instantiate("child", "u0");
		u0.setInstance(child);

		inner = reg("x");
		produced = block("blk", inner);
		IfGenerateConstruct gen = ifGen(num(1), block("blk", reg("x")));
		gen.setGenerated(Collections.singletonList(produced));

		outer = reg("x");
		top = module("top", outer, u0, gen);
		topScope = Scope.root(top, Identifier.of("top"));
	}

	@Test
	public void testInnermostScopeWins() {
		Reference fromBlock = ref("x");
		assertThat(resolver.resolve(fromBlock, topScope.enter(produced), false).get(), sameInstance(inner));
		Reference fromTop = ref("x");
		assertThat(resolver.resolve(fromTop, topScope, false).get(), sameInstance(outer));
	}

	@Test
	public void testHierarchicalThroughInstance() {
		assertThat(resolver.resolve(ref("u0.q"), topScope, false).get(), sameInstance(childReg));
	}

	@Test
	public void testHierarchicalThroughLabelledBlock() {
		assertThat(resolver.resolve(ref("blk.x"), topScope, false).get(), sameInstance(inner));
	}

	@Test
	public void testHierarchicalThroughInlinedBlock() {
		RegDeclaration flattened = reg("q");
		u0.setInlined(block("u0", flattened));
		assertThat(resolver.resolve(ref("u0.q"), topScope, false).get(), sameInstance(flattened));
	}

	@Test
	public void testLocalOnlyRejectsHierarchicalNames() {
		assertFalse(resolver.resolve(ref("u0.q"), topScope, true).isPresent());
		assertTrue(resolver.resolve(ref("x"), topScope, true).isPresent());
	}

	@Test
	public void testNonDeclarationTargetsDoNotResolve() {
		assertFalse(resolver.resolve(ref("u0"), topScope, false).isPresent());
		assertFalse(resolver.resolve(ref("u0.missing"), topScope, false).isPresent());
		assertFalse(resolver.resolve(ref("x.y"), topScope, false).isPresent());
	}

	@Test
	public void testResolveNameIsNotCached() {
		assertThat(resolver.resolveName("x", topScope).get(), sameInstance(outer));
		assertTrue(resolver.getCachedTargets().isEmpty());
	}

	@Test
	public void testInvalidateDropsEntriesPointingIntoSubtree() {
		Reference toChild = ref("u0.q");
		Reference toOuter = ref("x");
		resolver.resolve(toChild, topScope, false);
		resolver.resolve(toOuter, topScope, false);
		assertTrue(resolver.isCached(toChild));

		resolver.invalidate(u0);
		assertFalse(resolver.isCached(toChild));
		assertTrue(resolver.isCached(toOuter));
	}

	@Test
	public void testInvalidateDropsEntriesStartingInSubtree() {
		Reference r = ref("x");
		ContinuousAssign a = new ContinuousAssign(r.getLocation(), r, num(0));
		GenerateBlock holder = block("holder", a);
		resolver.resolve(r, topScope, false);
		resolver.invalidate(holder);
		assertFalse(resolver.isCached(r));
	}

	@Test
	public void testFullId() {
		assertThat(resolver.getFullId(topScope.enter(produced), "u1"), is(Identifier.of("top.blk.u1")));
		assertThat(resolver.getFullId(Scope.top(), "m"), is(Identifier.of("m")));
	}
}
