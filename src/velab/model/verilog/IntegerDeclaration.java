package velab.model.verilog;

import velab.util.SourceLocation;

public class IntegerDeclaration extends Declaration {

	public IntegerDeclaration(SourceLocation location, String name, Expression value) {
		super(location, name, value);
	}

	@Override
	public IntegerDeclaration copy() {
		return new IntegerDeclaration(getLocation(), getName(), copyValue());
	}

	@Override
	public <T, E extends Throwable> T accept(ModuleItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
