package tntc.model.tnt;

import tntc.util.SourceLocation;

/**
 * A reference to a named value
 *
 */
public class TntName extends TntExpression {

	private final String name;

	public TntName(SourceLocation location, long id, String name) {
		super(location, id);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(TntExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((name == null) ? 0 : name.hashCode());
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TntName other = (TntName) obj;
		if (name == null) {
			return other.name == null;
		} else return name.equals(other.name);
	}

}
