package velab.model.verilog;

import velab.util.SourceLocation;

/**
 * A {@code parameter} declaration. Its initializer is the default value, which instantiations may override.
 */
public class ParameterDeclaration extends Declaration {

	public ParameterDeclaration(SourceLocation location, String name, Expression value) {
		super(location, name, value);
	}

	@Override
	public ParameterDeclaration copy() {
		return new ParameterDeclaration(getLocation(), getName(), copyValue());
	}

	@Override
	public <T, E extends Throwable> T accept(ModuleItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
