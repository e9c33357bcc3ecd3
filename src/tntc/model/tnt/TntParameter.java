package tntc.model.tnt;

import java.util.Objects;

import tntc.util.SourceLocation;

/**
 * A lambda parameter. Its id is what a lookup table's PARAM definition points at.
 */
public class TntParameter extends TntNode {

	private final String name;

	public TntParameter(SourceLocation location, long id, String name) {
		super(location, id);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(TntNodeVisitor<T, E> v) throws E {
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
		TntParameter other = (TntParameter) obj;
		return Objects.equals(name, other.name);
	}

}
