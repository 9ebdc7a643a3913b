package velab.model.verilog;

import velab.util.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One arm of a case generate construct. An arm without match expressions is the default arm.
 */
public class CaseGenerateItem extends VerilogNode {

	private final List<Expression> matches;
	private final GenerateBlock block;

	public CaseGenerateItem(SourceLocation location, List<Expression> matches, GenerateBlock block) {
		super(location);
		this.matches = matches;
		this.block = block;
	}

	@Override
	public CaseGenerateItem copy() {
		return new CaseGenerateItem(getLocation(),
				matches.stream().map(Expression::copy).collect(Collectors.toList()), block.copy());
	}

	public List<Expression> getMatches() {
		return matches;
	}

	public boolean isDefault() {
		return matches.isEmpty();
	}

	public GenerateBlock getBlock() {
		return block;
	}

	@Override
	public <T, E extends Throwable> T accept(VerilogNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(matches, block);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		CaseGenerateItem that = (CaseGenerateItem) obj;
		return matches.equals(that.matches) && block.equals(that.block);
	}

}
