package tntc.model.tnt;

import java.util.Objects;

import tntc.util.SourceLocation;

/**
 *
 * TNT AST Node:
 *
 * type T = Set[int]    (alias)
 * type U               (uninterpreted, getType() is null)
 *
 */
public class TntTypeDefinition extends TntDeclaration {

	private final String name;
	private final TntType type;

	public TntTypeDefinition(SourceLocation location, long id, String name, TntType type) {
		super(location, id);
		this.name = name;
		this.type = type;
	}

	@Override
	public String getName() {
		return name;
	}

	public TntType getType() {
		return type;
	}

	public boolean isUninterpreted() {
		return type == null;
	}

	@Override
	public <T, E extends Throwable> T accept(TntDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TntTypeDefinition other = (TntTypeDefinition) obj;
		return Objects.equals(name, other.name) && Objects.equals(type, other.type);
	}

}
