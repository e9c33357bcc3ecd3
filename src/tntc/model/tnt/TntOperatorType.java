package tntc.model.tnt;

import java.util.List;
import java.util.Objects;

import tntc.util.SourceLocation;

/**
 * (arg1, arg2) => res
 */
public class TntOperatorType extends TntType {

	private final List<TntType> arguments;
	private final TntType result;

	public TntOperatorType(SourceLocation location, long id, List<TntType> arguments, TntType result) {
		super(location, id);
		this.arguments = arguments;
		this.result = result;
	}

	public List<TntType> getArguments() {
		return arguments;
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
		return Objects.hash("oper", arguments, result);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TntOperatorType other = (TntOperatorType) obj;
		return Objects.equals(arguments, other.arguments) && Objects.equals(result, other.result);
	}

}
