package tntc.model.tnt;

import java.math.BigInteger;
import java.util.Objects;

import tntc.util.SourceLocation;

public class TntInt extends TntExpression {

	private final BigInteger value;

	public TntInt(SourceLocation location, long id, BigInteger value) {
		super(location, id);
		this.value = value;
	}

	public BigInteger getValue() {
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
		TntInt other = (TntInt) obj;
		return Objects.equals(value, other.value);
	}

}
