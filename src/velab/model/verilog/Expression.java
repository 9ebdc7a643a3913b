package velab.model.verilog;

import velab.util.SourceLocation;

public abstract class Expression extends VerilogNode {

	public Expression(SourceLocation location) {
		super(location);
	}

	@Override
	public abstract Expression copy();

	public abstract <T, E extends Throwable> T accept(ExpressionVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(VerilogNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
