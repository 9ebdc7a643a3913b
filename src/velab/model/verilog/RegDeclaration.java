package velab.model.verilog;

import velab.util.SourceLocation;

public class RegDeclaration extends Declaration {

	public RegDeclaration(SourceLocation location, String name, Expression value) {
		super(location, name, value);
	}

	@Override
	public RegDeclaration copy() {
		return new RegDeclaration(getLocation(), getName(), copyValue());
	}

	@Override
	public <T, E extends Throwable> T accept(ModuleItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
