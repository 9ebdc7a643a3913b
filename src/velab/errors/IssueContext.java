package velab.errors;

public abstract class IssueContext {

	public abstract void error(Issue err);

	public abstract void warning(Issue warning);

	public abstract boolean hasErrors();

	public IssueContext withContext(Context context) {
		return new NestedIssueContext(this, context);
	}
}
