package velab.model.verilog;

import velab.util.SourceLocation;

import java.util.Objects;
import java.util.Optional;

public class IfGenerateConstruct extends GenerateConstruct {

	private final Expression condition;
	private final GenerateBlock yes;
	private final GenerateBlock no;

	public IfGenerateConstruct(SourceLocation location, Expression condition, GenerateBlock yes, GenerateBlock no) {
		super(location);
		this.condition = condition;
		this.yes = yes;
		this.no = no;
	}

	@Override
	public IfGenerateConstruct copy() {
		return new IfGenerateConstruct(getLocation(), condition.copy(), yes.copy(), no == null ? null : no.copy());
	}

	public Expression getCondition() {
		return condition;
	}

	public GenerateBlock getYes() {
		return yes;
	}

	public Optional<GenerateBlock> getNo() {
		return Optional.ofNullable(no);
	}

	@Override
	public <T, E extends Throwable> T accept(GenerateConstructVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public <T, E extends Throwable> T accept(ModuleItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, yes, no);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		IfGenerateConstruct that = (IfGenerateConstruct) obj;
		return condition.equals(that.condition) && yes.equals(that.yes) && Objects.equals(no, that.no);
	}

}
