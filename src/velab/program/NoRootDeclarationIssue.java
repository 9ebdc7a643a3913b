package velab.program;

import velab.errors.Issue;
import velab.errors.IssueVisitor;
import velab.model.verilog.ModuleItem;

/**
 * An item was evaluated before any module had been declared.
 */
public class NoRootDeclarationIssue extends Issue {
	private final ModuleItem item;

	public NoRootDeclarationIssue(ModuleItem item) {
		this.item = item;
	}

	public ModuleItem getItem() {
		return item;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
