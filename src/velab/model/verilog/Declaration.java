package velab.model.verilog;

import velab.util.SourceLocation;

import java.util.Objects;
import java.util.Optional;

/**
 * A named declaration with an optional initializer. The initial value is computed by constant evaluation
 * during elaboration and stays unset when the initializer is absent or not constant.
 */
public abstract class Declaration extends ModuleItem {

	private final String name;
	private final Expression value;
	private Long initialValue;

	public Declaration(SourceLocation location, String name, Expression value) {
		super(location);
		this.name = name;
		this.value = value;
		this.initialValue = null;
	}

	public String getName() {
		return name;
	}

	public Optional<Expression> getValue() {
		return Optional.ofNullable(value);
	}

	protected Expression copyValue() {
		return value == null ? null : value.copy();
	}

	public Optional<Long> getInitialValue() {
		return Optional.ofNullable(initialValue);
	}

	public void setInitialValue(long initialValue) {
		this.initialValue = initialValue;
	}

	public void clearInitialValue() {
		this.initialValue = null;
	}

	@Override
	public abstract Declaration copy();

	@Override
	public int hashCode() {
		return Objects.hash(getClass(), name, value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		Declaration that = (Declaration) obj;
		return name.equals(that.name) && Objects.equals(value, that.value);
	}

}
