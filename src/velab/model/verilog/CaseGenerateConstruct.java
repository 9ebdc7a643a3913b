package velab.model.verilog;

import velab.util.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public class CaseGenerateConstruct extends GenerateConstruct {

	private final Expression subject;
	private final List<CaseGenerateItem> items;

	public CaseGenerateConstruct(SourceLocation location, Expression subject, List<CaseGenerateItem> items) {
		super(location);
		this.subject = subject;
		this.items = items;
	}

	@Override
	public CaseGenerateConstruct copy() {
		return new CaseGenerateConstruct(getLocation(), subject.copy(),
				items.stream().map(CaseGenerateItem::copy).collect(Collectors.toList()));
	}

	public Expression getSubject() {
		return subject;
	}

	public List<CaseGenerateItem> getItems() {
		return items;
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
		return Objects.hash(subject, items);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		CaseGenerateConstruct that = (CaseGenerateConstruct) obj;
		return subject.equals(that.subject) && items.equals(that.items);
	}

}
