package velab.program;

import velab.errors.Issue;
import velab.errors.IssueVisitor;
import velab.model.verilog.Identifier;
import velab.model.verilog.ModuleItem;

/**
 * The first evaluated item was not an instantiation of the most recently declared module.
 */
public class RootInstantiationMismatchIssue extends Issue {
	private final ModuleItem item;
	private final Identifier expected;

	public RootInstantiationMismatchIssue(ModuleItem item, Identifier expected) {
		this.item = item;
		this.expected = expected;
	}

	public ModuleItem getItem() {
		return item;
	}

	public Identifier getExpected() {
		return expected;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
