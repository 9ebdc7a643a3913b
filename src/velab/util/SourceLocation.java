package velab.util;

import java.nio.file.Path;
import java.util.Objects;

public class SourceLocation implements Comparable<SourceLocation> {
	private final Path file;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(Path file, int startLine, int endLine, int startColumn, int endColumn) {
		this.file = file;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return file == null && startLine == -1;
	}

	public Path getFile() {
		return file;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	public String prettyString() {
		if (isUnknown()) {
			return "at unknown source location";
		}
		StringBuilder b = new StringBuilder("at ");
		if (startLine != endLine) {
			b.append(startLine + 1).append(':').append(startColumn + 1)
					.append('-').append(endLine + 1).append(':').append(endColumn);
		} else {
			b.append("line ").append(startLine + 1).append(", columns ")
					.append(startColumn + 1).append('-').append(endColumn);
		}
		if (file != null) {
			b.append(" in ").append(file);
		}
		return b.toString();
	}

	@Override
	public int compareTo(SourceLocation other) {
		if (startLine != other.startLine) {
			return Integer.compare(startLine, other.startLine);
		}
		return Integer.compare(startColumn, other.startColumn);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		SourceLocation that = (SourceLocation) o;
		return startLine == that.startLine &&
				endLine == that.endLine &&
				startColumn == that.startColumn &&
				endColumn == that.endColumn &&
				Objects.equals(file, that.file);
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, startLine, endLine, startColumn, endColumn);
	}

	@Override
	public String toString() {
		return prettyString();
	}
}
