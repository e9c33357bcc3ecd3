package tntc.model.tnt;

import java.util.Objects;

import tntc.util.SourceLocation;

/**
 * List[elem]
 */
public class TntListType extends TntType {

	private final TntType elementType;

	public TntListType(SourceLocation location, long id, TntType elementType) {
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
		return Objects.hash("List", elementType);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TntListType other = (TntListType) obj;
		return Objects.equals(elementType, other.elementType);
	}

}
