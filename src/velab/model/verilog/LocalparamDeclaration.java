package velab.model.verilog;

import velab.util.SourceLocation;

public class LocalparamDeclaration extends Declaration {

	public LocalparamDeclaration(SourceLocation location, String name, Expression value) {
		super(location, name, value);
	}

	@Override
	public LocalparamDeclaration copy() {
		return new LocalparamDeclaration(getLocation(), getName(), copyValue());
	}

	@Override
	public <T, E extends Throwable> T accept(ModuleItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
