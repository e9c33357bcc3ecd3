package tntc.model.tnt;

import java.util.Objects;

import tntc.util.SourceLocation;

/**
 * A reference to a named type: either an alias or an uninterpreted type
 */
public class TntConstType extends TntType {

	private final String name;

	public TntConstType(SourceLocation location, long id, String name) {
		super(location, id);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(TntTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(name);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TntConstType other = (TntConstType) obj;
		return Objects.equals(name, other.name);
	}

}
