package tntc.model.tnt;

import tntc.util.SourceLocation;

/**
 * Base TNT expression representation
 *
 */
public abstract class TntExpression extends TntNode {

	public TntExpression(SourceLocation location, long id) {
		super(location, id);
	}

	@Override
	public <T, E extends Throwable> T accept(TntNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(TntExpressionVisitor<T, E> v) throws E;

}
