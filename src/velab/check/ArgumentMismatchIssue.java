package velab.check;

import velab.errors.Issue;
import velab.errors.IssueVisitor;
import velab.model.verilog.ArgAssign;
import velab.model.verilog.ModuleInstantiation;

/**
 * An instantiation binds a parameter or port its module does not have: either a named binding with an unknown
 * name, or an ordered binding past the end of the module's list.
 */
public class ArgumentMismatchIssue extends Issue {

	public enum Kind {
		PARAMETER,
		PORT,
	}

	private final ModuleInstantiation instantiation;
	private final ArgAssign argument;
	private final Kind kind;

	public ArgumentMismatchIssue(ModuleInstantiation instantiation, ArgAssign argument, Kind kind) {
		this.instantiation = instantiation;
		this.argument = argument;
		this.kind = kind;
	}

	public ModuleInstantiation getInstantiation() {
		return instantiation;
	}

	public ArgAssign getArgument() {
		return argument;
	}

	public Kind getKind() {
		return kind;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
