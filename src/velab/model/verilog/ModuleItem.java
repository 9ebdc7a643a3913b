package velab.model.verilog;

import velab.util.SourceLocation;

public abstract class ModuleItem extends VerilogNode {

	public ModuleItem(SourceLocation location) {
		super(location);
	}

	@Override
	public abstract ModuleItem copy();

	public abstract <T, E extends Throwable> T accept(ModuleItemVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(VerilogNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
