package velab.model.verilog;

import velab.util.SourceLocation;

/**
 * A {@code wire} declaration, optionally with a net declaration assignment.
 */
public class NetDeclaration extends Declaration {

	public NetDeclaration(SourceLocation location, String name, Expression value) {
		super(location, name, value);
	}

	@Override
	public NetDeclaration copy() {
		return new NetDeclaration(getLocation(), getName(), copyValue());
	}

	@Override
	public <T, E extends Throwable> T accept(ModuleItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
