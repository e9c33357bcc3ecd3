package tntc.model.tnt;

import tntc.util.SourceLocation;

/**
 * Base class of type expressions appearing in annotations and type definitions
 *
 */
public abstract class TntType extends TntNode {

	public TntType(SourceLocation location, long id) {
		super(location, id);
	}

	@Override
	public <T, E extends Throwable> T accept(TntNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(TntTypeVisitor<T, E> v) throws E;

}
