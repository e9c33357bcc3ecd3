package tntc.model.tnt;

import java.util.Objects;

import tntc.util.SourceLocation;

/**
 *
 * TNT AST Node:
 *
 * val x = <expr> { <body> }
 *
 * The bound operator is visible in the body and in its own definition.
 *
 */
public class TntLet extends TntExpression {

	private final TntOperatorDefinition definition;
	private final TntExpression body;

	public TntLet(SourceLocation location, long id, TntOperatorDefinition definition, TntExpression body) {
		super(location, id);
		this.definition = definition;
		this.body = body;
	}

	public TntOperatorDefinition getDefinition() {
		return definition;
	}

	public TntExpression getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(TntExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((body == null) ? 0 : body.hashCode());
		result = prime * result + ((definition == null) ? 0 : definition.hashCode());
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
		TntLet other = (TntLet) obj;
		return Objects.equals(body, other.body) && Objects.equals(definition, other.definition);
	}

}
