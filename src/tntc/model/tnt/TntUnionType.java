package tntc.model.tnt;

import java.util.List;
import java.util.Objects;

import tntc.util.SourceLocation;

/**
 *
 * A discriminated union of records:
 *
 * | { tag: "a", x: int } | { tag: "b", y: str }
 *
 */
public class TntUnionType extends TntType {

	public static class Record {
		private final String tagValue;
		private final Row fields;

		public Record(String tagValue, Row fields) {
			this.tagValue = tagValue;
			this.fields = fields;
		}

		public String getTagValue() {
			return tagValue;
		}

		public Row getFields() {
			return fields;
		}

		@Override
		public int hashCode() {
			return Objects.hash(tagValue, fields);
		}

		@Override
		public boolean equals(Object obj) {
			if (this == obj)
				return true;
			if (obj == null)
				return false;
			if (getClass() != obj.getClass())
				return false;
			Record other = (Record) obj;
			return Objects.equals(tagValue, other.tagValue) && Objects.equals(fields, other.fields);
		}
	}

	private final String tag;
	private final List<Record> records;

	public TntUnionType(SourceLocation location, long id, String tag, List<Record> records) {
		super(location, id);
		this.tag = tag;
		this.records = records;
	}

	public String getTag() {
		return tag;
	}

	public List<Record> getRecords() {
		return records;
	}

	@Override
	public <T, E extends Throwable> T accept(TntTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(tag, records);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TntUnionType other = (TntUnionType) obj;
		return Objects.equals(tag, other.tag) && Objects.equals(records, other.records);
	}

}
