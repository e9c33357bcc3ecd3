package tntc.model.tnt;

import java.util.List;
import java.util.Objects;

/**
 * The fields of a tuple or record type. A row is closed when it has no row variable,
 * otherwise {@link #getOther()} names the variable standing for the remaining fields.
 */
public class Row {

	public static class Field {
		private final String fieldName;
		private final TntType fieldType;

		public Field(String fieldName, TntType fieldType) {
			this.fieldName = fieldName;
			this.fieldType = fieldType;
		}

		public String getFieldName() {
			return fieldName;
		}

		public TntType getFieldType() {
			return fieldType;
		}

		@Override
		public int hashCode() {
			return Objects.hash(fieldName, fieldType);
		}

		@Override
		public boolean equals(Object obj) {
			if (this == obj)
				return true;
			if (obj == null)
				return false;
			if (getClass() != obj.getClass())
				return false;
			Field other = (Field) obj;
			return Objects.equals(fieldName, other.fieldName) && Objects.equals(fieldType, other.fieldType);
		}
	}

	private final List<Field> fields;
	private final String other;

	public Row(List<Field> fields, String other) {
		this.fields = fields;
		this.other = other;
	}

	public List<Field> getFields() {
		return fields;
	}

	public String getOther() {
		return other;
	}

	public boolean isClosed() {
		return other == null;
	}

	@Override
	public int hashCode() {
		return Objects.hash(fields, other);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Row o = (Row) obj;
		return Objects.equals(fields, o.fields) && Objects.equals(other, o.other);
	}
}
