package tntc.model.tnt;

import tntc.formatters.IndentingWriter;
import tntc.formatters.TntNodeFormattingVisitor;
import tntc.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 *
 * The base class for any TNT AST node. Every node carries the numeric id the parser gave it
 * (or the id a pass minted for it), which lookup tables use to point back at defining
 * occurrences.
 *
 * Ids and locations do not take part in equality: two nodes are equal when they have the
 * same shape.
 *
 */
public abstract class TntNode {
	private final SourceLocation location;
	private final long id;

	public TntNode(SourceLocation location, long id) {
		this.location = location;
		this.id = id;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public long getId() {
		return id;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new TntNodeFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new RuntimeException("You should never get an IO error from a StringWriter", e);
		}
		return out.toString();
	}

	public abstract <T, E extends Throwable> T accept(TntNodeVisitor<T, E> v) throws E;

}
