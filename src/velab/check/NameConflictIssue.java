package velab.check;

import velab.errors.Issue;
import velab.errors.IssueVisitor;
import velab.model.verilog.Identifier;
import velab.util.SourceLocation;

/**
 * Two things claim the same hierarchical name: two items of one scope, or a new instance and one that has
 * already been elaborated.
 */
public class NameConflictIssue extends Issue {
	private final Identifier name;
	private final SourceLocation location;
	private final SourceLocation previous;

	public NameConflictIssue(Identifier name, SourceLocation location, SourceLocation previous) {
		this.name = name;
		this.location = location;
		this.previous = previous;
	}

	public Identifier getName() {
		return name;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public SourceLocation getPrevious() {
		return previous;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
