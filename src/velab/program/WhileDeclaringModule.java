package velab.program;

import velab.errors.Context;
import velab.errors.ContextVisitor;
import velab.model.verilog.Identifier;

public class WhileDeclaringModule extends Context {
	private final Identifier moduleId;

	public WhileDeclaringModule(Identifier moduleId) {
		this.moduleId = moduleId;
	}

	public Identifier getModuleId() {
		return moduleId;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
