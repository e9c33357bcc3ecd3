package tntc.model.tnt;

import java.util.Objects;

import tntc.util.SourceLocation;

public class TntStr extends TntExpression {

	private final String value;

	public TntStr(SourceLocation location, long id, String value) {
		super(location, id);
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(TntExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TntStr other = (TntStr) obj;
		return Objects.equals(value, other.value);
	}

}
