package velab.errors;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import velab.formatters.IndentingWriter;
import velab.formatters.IssueFormattingVisitor;

public class TopLevelIssueContext extends IssueContext {

	private final List<Issue> errors;
	private final List<Issue> warnings;

	public TopLevelIssueContext() {
		this.errors = new ArrayList<>();
		this.warnings = new ArrayList<>();
	}

	@Override
	public void error(Issue err) {
		errors.add(err);
	}

	@Override
	public void warning(Issue warning) {
		warnings.add(warning);
	}

	@Override
	public boolean hasErrors() {
		return !errors.isEmpty();
	}

	public boolean hasWarnings() {
		return !warnings.isEmpty();
	}

	public List<Issue> getIssues() {
		return Collections.unmodifiableList(errors);
	}

	public List<Issue> getWarnings() {
		return Collections.unmodifiableList(warnings);
	}

	/**
	 * Replays every error and warning collected so far into another context, in the order they were reported.
	 */
	public void copyTo(IssueContext target) {
		for (Issue warning : warnings) {
			target.warning(warning);
		}
		for (Issue error : errors) {
			target.error(error);
		}
	}

	public void format(IndentingWriter out) throws IOException {
		out.write("Detected ");
		out.write(Integer.toString(errors.size()));
		out.write(" issue(s) and ");
		out.write(Integer.toString(warnings.size()));
		out.write(" warning(s):");
		for (Issue e : errors) {
			out.newLine();
			e.accept(new IssueFormattingVisitor(out));
		}
		for (Issue w : warnings) {
			out.newLine();
			out.write("warning: ");
			w.accept(new IssueFormattingVisitor(out));
		}
	}

	public String format() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			format(out);
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return w.toString();
	}
}
