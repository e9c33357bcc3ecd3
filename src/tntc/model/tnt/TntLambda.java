package tntc.model.tnt;

import java.util.List;
import java.util.Objects;

import tntc.util.SourceLocation;

/**
 *
 * TNT AST Node:
 *
 * (a, b) => <expr>
 *
 * A lambda's parameters are only visible inside its body.
 *
 */
public class TntLambda extends TntExpression {

	private final List<TntParameter> params;
	private final TntOperatorDefinition.Qualifier qualifier;
	private final TntExpression body;

	public TntLambda(SourceLocation location, long id, List<TntParameter> params,
	                 TntOperatorDefinition.Qualifier qualifier, TntExpression body) {
		super(location, id);
		this.params = params;
		this.qualifier = qualifier;
		this.body = body;
	}

	public List<TntParameter> getParams() {
		return params;
	}

	public TntOperatorDefinition.Qualifier getQualifier() {
		return qualifier;
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
		return Objects.hash(params, qualifier, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TntLambda other = (TntLambda) obj;
		return Objects.equals(params, other.params) && qualifier == other.qualifier &&
				Objects.equals(body, other.body);
	}

}
