package tntc.model.tnt;

import tntc.util.SourceLocation;

/**
 * bool, int or str
 */
public class TntPrimitiveType extends TntType {

	public enum Kind {
		BOOL("bool"),
		INT("int"),
		STR("str");

		private final String keyword;

		Kind(String keyword) {
			this.keyword = keyword;
		}

		public String getKeyword() {
			return keyword;
		}
	}

	private final Kind kind;

	public TntPrimitiveType(SourceLocation location, long id, Kind kind) {
		super(location, id);
		this.kind = kind;
	}

	public Kind getKind() {
		return kind;
	}

	@Override
	public <T, E extends Throwable> T accept(TntTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return kind.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TntPrimitiveType other = (TntPrimitiveType) obj;
		return kind == other.kind;
	}

}
