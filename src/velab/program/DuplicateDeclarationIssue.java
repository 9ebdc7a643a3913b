package velab.program;

import velab.errors.Issue;
import velab.errors.IssueVisitor;
import velab.model.verilog.ModuleDeclaration;

public class DuplicateDeclarationIssue extends Issue {
	private final ModuleDeclaration declaration;
	private final ModuleDeclaration existing;

	public DuplicateDeclarationIssue(ModuleDeclaration declaration, ModuleDeclaration existing) {
		this.declaration = declaration;
		this.existing = existing;
	}

	public ModuleDeclaration getDeclaration() {
		return declaration;
	}

	public ModuleDeclaration getExisting() {
		return existing;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
