package velab.errors;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import org.junit.Test;

import velab.check.UnresolvedReferenceIssue;
import velab.model.verilog.Identifier;
import velab.model.verilog.ModuleDeclaration;
import velab.program.DuplicateDeclarationIssue;
import velab.program.WhileDeclaringModule;
import velab.util.SourceLocation;

import static velab.model.verilog.VerilogBuilder.*;

public class TopLevelIssueContextTest {

	private static final String NL = System.lineSeparator();

	@Test
	public void testNestedContextWrapsIssues() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		IssueContext nested = ctx.withContext(new WhileDeclaringModule(Identifier.of("M")));
		assertFalse(nested.hasErrors());

		ModuleDeclaration md = module("M", reg("r"));
		nested.error(new DuplicateDeclarationIssue(md, md));
		assertTrue(nested.hasErrors());
		assertTrue(ctx.hasErrors());

		IssueWithContext issue = (IssueWithContext) ctx.getIssues().get(0);
		assertThat(issue.getIssue(), instanceOf(DuplicateDeclarationIssue.class));
		assertThat(((WhileDeclaringModule) issue.getContext()).getModuleId(), is(Identifier.of("M")));
	}

	@Test
	public void testFormat() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ModuleDeclaration md = module("M", reg("r"));
		ctx.withContext(new WhileDeclaringModule(Identifier.of("M"))).error(new DuplicateDeclarationIssue(md, md));
		ctx.warning(new UnresolvedReferenceIssue(Identifier.of("u0.q"), SourceLocation.unknown()));

		assertThat(ctx.format(), is(
				"Detected 1 issue(s) and 1 warning(s):" + NL +
				"while declaring module M" + NL +
				"    module M at unknown source location is already declared at unknown source location" + NL +
				"warning: could not resolve name u0.q at unknown source location"));
	}

	@Test
	public void testCopyToKeepsOrder() {
		TopLevelIssueContext source = new TopLevelIssueContext();
		Issue first = new UnresolvedReferenceIssue(Identifier.of("a"), SourceLocation.unknown());
		Issue second = new UnresolvedReferenceIssue(Identifier.of("b"), SourceLocation.unknown());
		Issue warning = new UnresolvedReferenceIssue(Identifier.of("c.d"), SourceLocation.unknown());
		source.error(first);
		source.warning(warning);
		source.error(second);

		TopLevelIssueContext target = new TopLevelIssueContext();
		source.copyTo(target);
		assertThat(target.getIssues().size(), is(2));
		assertThat(target.getIssues().get(0), sameInstance(first));
		assertThat(target.getIssues().get(1), sameInstance(second));
		assertThat(target.getWarnings().get(0), sameInstance(warning));
		assertFalse(source.getIssues().isEmpty());
	}
}
