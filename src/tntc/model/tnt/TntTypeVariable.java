package tntc.model.tnt;

import java.util.Objects;

import tntc.util.SourceLocation;

/**
 * A type variable, written with a lowercase name: a, b
 */
public class TntTypeVariable extends TntType {

	private final String name;

	public TntTypeVariable(SourceLocation location, long id, String name) {
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
		TntTypeVariable other = (TntTypeVariable) obj;
		return Objects.equals(name, other.name);
	}

}
