package velab.model.verilog;

import velab.util.SourceLocation;

import java.util.Objects;

/**
 * {@code for (genvar = init; condition; genvar = update) begin : label ... end}
 */
public class LoopGenerateConstruct extends GenerateConstruct {

	private final String genvar;
	private final Expression init;
	private final Expression condition;
	private final Expression update;
	private final GenerateBlock body;

	public LoopGenerateConstruct(SourceLocation location, String genvar, Expression init, Expression condition,
	                             Expression update, GenerateBlock body) {
		super(location);
		this.genvar = genvar;
		this.init = init;
		this.condition = condition;
		this.update = update;
		this.body = body;
	}

	@Override
	public LoopGenerateConstruct copy() {
		return new LoopGenerateConstruct(getLocation(), genvar, init.copy(), condition.copy(), update.copy(),
				body.copy());
	}

	public String getGenvar() {
		return genvar;
	}

	public Expression getInit() {
		return init;
	}

	public Expression getCondition() {
		return condition;
	}

	public Expression getUpdate() {
		return update;
	}

	public GenerateBlock getBody() {
		return body;
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
		return Objects.hash(genvar, init, condition, update, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		LoopGenerateConstruct that = (LoopGenerateConstruct) obj;
		return genvar.equals(that.genvar) &&
				init.equals(that.init) &&
				condition.equals(that.condition) &&
				update.equals(that.update) &&
				body.equals(that.body);
	}

}
