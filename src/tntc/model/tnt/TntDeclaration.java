package tntc.model.tnt;

import tntc.util.SourceLocation;

/**
 * A top-level (or let-bound) declaration inside a module
 *
 */
public abstract class TntDeclaration extends TntNode {

	public TntDeclaration(SourceLocation location, long id) {
		super(location, id);
	}

	/**
	 * @return the name this declaration introduces, or the imported module's name for imports
	 */
	public abstract String getName();

	@Override
	public <T, E extends Throwable> T accept(TntNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(TntDeclarationVisitor<T, E> v) throws E;

}
