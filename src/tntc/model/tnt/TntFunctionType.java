package tntc.model.tnt;

import java.util.Objects;

import tntc.util.SourceLocation;

/**
 * arg -> res
 */
public class TntFunctionType extends TntType {

	private final TntType argument;
	private final TntType result;

	public TntFunctionType(SourceLocation location, long id, TntType argument, TntType result) {
		super(location, id);
		this.argument = argument;
		this.result = result;
	}

	public TntType getArgument() {
		return argument;
	}

	public TntType getResult() {
		return result;
	}

	@Override
	public <T, E extends Throwable> T accept(TntTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash("fun", argument, result);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TntFunctionType other = (TntFunctionType) obj;
		return Objects.equals(argument, other.argument) && Objects.equals(result, other.result);
	}

}
