package velab.check;

import velab.errors.Issue;
import velab.errors.IssueVisitor;
import velab.model.verilog.LoopGenerateConstruct;

public class GenerateLoopLimitIssue extends Issue {
	private final LoopGenerateConstruct loop;
	private final int limit;

	public GenerateLoopLimitIssue(LoopGenerateConstruct loop, int limit) {
		this.loop = loop;
		this.limit = limit;
	}

	public LoopGenerateConstruct getLoop() {
		return loop;
	}

	public int getLimit() {
		return limit;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
