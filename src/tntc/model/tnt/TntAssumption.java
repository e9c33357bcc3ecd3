package tntc.model.tnt;

import java.util.Objects;

import tntc.util.SourceLocation;

/**
 *
 * TNT AST Node:
 *
 * assume Name = <expr>
 *
 */
public class TntAssumption extends TntDeclaration {

	private final String name;
	private final TntExpression assumption;

	public TntAssumption(SourceLocation location, long id, String name, TntExpression assumption) {
		super(location, id);
		this.name = name;
		this.assumption = assumption;
	}

	@Override
	public String getName() {
		return name;
	}

	public TntExpression getAssumption() {
		return assumption;
	}

	@Override
	public <T, E extends Throwable> T accept(TntDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, assumption);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TntAssumption other = (TntAssumption) obj;
		return Objects.equals(name, other.name) && Objects.equals(assumption, other.assumption);
	}

}
