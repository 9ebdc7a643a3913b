package velab.errors;

import velab.check.WhileElaboratingScope;
import velab.program.WhileDeclaringModule;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileElaboratingScope whileElaboratingScope) throws E;
	public abstract T visit(WhileDeclaringModule whileDeclaringModule) throws E;

}
