package velab.model.verilog;

import velab.util.SourceLocation;

public class GenvarDeclaration extends Declaration {

	public GenvarDeclaration(SourceLocation location, String name) {
		super(location, name, null);
	}

	@Override
	public GenvarDeclaration copy() {
		return new GenvarDeclaration(getLocation(), getName());
	}

	@Override
	public <T, E extends Throwable> T accept(ModuleItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
