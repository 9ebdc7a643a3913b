package velab.model.verilog;

import velab.util.SourceLocation;

import java.util.Objects;

public class ContinuousAssign extends ModuleItem {

	private final Reference lhs;
	private final Expression rhs;

	public ContinuousAssign(SourceLocation location, Reference lhs, Expression rhs) {
		super(location);
		this.lhs = lhs;
		this.rhs = rhs;
	}

	@Override
	public ContinuousAssign copy() {
		return new ContinuousAssign(getLocation(), lhs.copy(), rhs.copy());
	}

	public Reference getLHS() {
		return lhs;
	}

	public Expression getRHS() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(ModuleItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lhs, rhs);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		ContinuousAssign that = (ContinuousAssign) obj;
		return lhs.equals(that.lhs) && rhs.equals(that.rhs);
	}

}
