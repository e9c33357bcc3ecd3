package tntc.model.tnt;

import java.util.Objects;

import tntc.util.SourceLocation;

/**
 * { f1: t1, f2: t2 }
 */
public class TntRecordType extends TntType {

	private final Row fields;

	public TntRecordType(SourceLocation location, long id, Row fields) {
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
		return Objects.hash("rec", fields);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TntRecordType other = (TntRecordType) obj;
		return Objects.equals(fields, other.fields);
	}

}
