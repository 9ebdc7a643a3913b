package velab.check;

import velab.errors.Issue;
import velab.errors.IssueVisitor;
import velab.model.verilog.Identifier;
import velab.model.verilog.ModuleInstantiation;

public class InstantiationDepthIssue extends Issue {
	private final ModuleInstantiation instantiation;
	private final Identifier path;
	private final int limit;

	public InstantiationDepthIssue(ModuleInstantiation instantiation, Identifier path, int limit) {
		this.instantiation = instantiation;
		this.path = path;
		this.limit = limit;
	}

	public ModuleInstantiation getInstantiation() {
		return instantiation;
	}

	public Identifier getPath() {
		return path;
	}

	public int getLimit() {
		return limit;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
