package tntc.util;

import tntc.Unreachable;
import tntc.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Objects;

/**
 * Where a parsed node came from. The parser hands these over as-is; nodes synthesized by a
 * pass reuse the location of the node they were derived from.
 */
public class SourceLocation implements Comparable<SourceLocation> {
	private final String source;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(String source, int startLine, int endLine, int startColumn, int endColumn) {
		this.source = source;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public String prettyString() {
		StringWriter sw = new StringWriter();
		writePretty(new IndentingWriter(sw));
		return sw.getBuffer().toString();
	}

	public void writePretty(IndentingWriter out) {
		try {
			if(isUnknown()) {
				out.write("at unknown source location");
			} else {
				out.write("at ");
				if(startLine != endLine) {
					out.write(""+(startLine+1)+":"+(startColumn+1)+"-"+(endLine+1)+":"+endColumn);
				} else {
					if(startColumn != endColumn) {
						out.write(""+(startLine+1)+":"+(startColumn+1)+"-"+endColumn);
					} else {
						out.write(""+(startLine+1)+":"+(startColumn+1));
					}
				}
				out.write(" in "+source);
			}
		} catch (IOException e) {
			throw new Unreachable(); // string ops shouldn't throw IO exceptions
		}
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return source == null;
	}

	public String getSource() {
		return source;
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

	@Override
	public int hashCode() {
		return Objects.hash(source, startLine, endLine, startColumn, endColumn);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return endColumn == other.endColumn && endLine == other.endLine && startColumn == other.startColumn &&
				startLine == other.startLine && Objects.equals(source, other.source);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		} else {
			return "SourceLocation [source=" + source + ", startLine=" + startLine + ", endLine=" + endLine +
					", startColumn=" + startColumn + ", endColumn=" + endColumn + "]";
		}
	}

	@Override
	public int compareTo(SourceLocation o) {
		if (isUnknown() && o.isUnknown()) {
			return 0;
		}
		if (isUnknown()) {
			return -1;
		}
		if (o.isUnknown()) {
			return 1;
		}
		int comparedSource = getSource().compareTo(o.getSource());
		if (comparedSource != 0) {
			return comparedSource;
		}
		int comparedStartLine = Integer.compare(getStartLine(), o.getStartLine());
		if (comparedStartLine != 0) {
			return comparedStartLine;
		}
		return Integer.compare(getStartColumn(), o.getStartColumn());
	}

}
