package velab.check;

import velab.errors.Issue;
import velab.errors.IssueVisitor;
import velab.model.verilog.ContinuousAssign;
import velab.model.verilog.Declaration;

public class InvalidAssignmentTargetIssue extends Issue {
	private final ContinuousAssign assign;
	private final Declaration target;

	public InvalidAssignmentTargetIssue(ContinuousAssign assign, Declaration target) {
		this.assign = assign;
		this.target = target;
	}

	public ContinuousAssign getAssign() {
		return assign;
	}

	public Declaration getTarget() {
		return target;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
