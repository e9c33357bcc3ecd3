package tntc.model.tnt;

import java.util.List;

import tntc.util.SourceLocation;

/**
 *
 * TNT AST Node:
 *
 * module Name {
 *     ...declarations
 * }
 *
 */
public class TntModule extends TntNode {

	private final String name;
	private final List<TntDeclaration> declarations;

	public TntModule(SourceLocation location, long id, String name, List<TntDeclaration> declarations) {
		super(location, id);
		this.name = name;
		this.declarations = declarations;
	}

	public String getName() {
		return name;
	}

	public List<TntDeclaration> getDeclarations() {
		return declarations;
	}

	public TntModule withDeclarations(List<TntDeclaration> newDeclarations) {
		return new TntModule(getLocation(), getId(), name, newDeclarations);
	}

	@Override
	public <T, E extends Throwable> T accept(TntNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((declarations == null) ? 0 : declarations.hashCode());
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
		TntModule other = (TntModule) obj;
		if (declarations == null) {
			if (other.declarations != null)
				return false;
		} else if (!declarations.equals(other.declarations))
			return false;
		if (name == null) {
			return other.name == null;
		} else return name.equals(other.name);
	}

}
