package tntc.model.tnt;

import java.util.Objects;

import tntc.util.SourceLocation;

/**
 * Set[elem]
 */
public class TntSetType extends TntType {

	private final TntType elementType;

	public TntSetType(SourceLocation location, long id, TntType elementType) {
		super(location, id);
		this.elementType = elementType;
	}

	public TntType getElementType() {
		return elementType;
	}

	@Override
	public <T, E extends Throwable> T accept(TntTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash("Set", elementType);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TntSetType other = (TntSetType) obj;
		return Objects.equals(elementType, other.elementType);
	}

}
