package tntc.model.tnt;

import tntc.util.SourceLocation;

public class TntBool extends TntExpression {

	private final boolean value;

	public TntBool(SourceLocation location, long id, boolean value) {
		super(location, id);
		this.value = value;
	}

	public boolean getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(TntExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return value ? 1231 : 1237;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TntBool other = (TntBool) obj;
		return value == other.value;
	}

}
