package velab.check;

import velab.errors.Issue;
import velab.errors.IssueVisitor;
import velab.model.verilog.ModuleInstantiation;

public class UnresolvedModuleIssue extends Issue {
	private final ModuleInstantiation instantiation;

	public UnresolvedModuleIssue(ModuleInstantiation instantiation) {
		this.instantiation = instantiation;
	}

	public ModuleInstantiation getInstantiation() {
		return instantiation;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
