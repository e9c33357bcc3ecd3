package tntc.model.tnt;

import java.util.Objects;

import tntc.util.SourceLocation;

/**
 * (t1, t2, ...), fields named by position
 */
public class TntTupleType extends TntType {

	private final Row fields;

	public TntTupleType(SourceLocation location, long id, Row fields) {
		super(location, id);
		this.fields = fields;
	}

	public Row getFields() {
		return fields;
	}

	@Override
	public <T, E extends Throwable> T accept(TntTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash("tup", fields);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TntTupleType other = (TntTupleType) obj;
		return Objects.equals(fields, other.fields);
	}

}
