package velab.check;

import velab.errors.Context;
import velab.errors.ContextVisitor;
import velab.model.verilog.Identifier;

public class WhileElaboratingScope extends Context {
	private final Identifier path;

	public WhileElaboratingScope(Identifier path) {
		this.path = path;
	}

	public Identifier getPath() {
		return path;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
