package velab.check;

import velab.errors.Issue;
import velab.errors.IssueVisitor;
import velab.model.verilog.Identifier;
import velab.util.SourceLocation;

import java.util.Objects;

public class UnresolvedReferenceIssue extends Issue {
	private final Identifier name;
	private final SourceLocation location;

	public UnresolvedReferenceIssue(Identifier name, SourceLocation location) {
		this.name = name;
		this.location = location;
	}

	public Identifier getName() {
		return name;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		UnresolvedReferenceIssue that = (UnresolvedReferenceIssue) o;
		return name.equals(that.name) && location.equals(that.location);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, location);
	}
}
