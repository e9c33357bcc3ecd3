package tntc.trans.passes.flattening;

/**
 * Mints node ids above a given bound. One generator belongs to one flattening run.
 */
public class IdGenerator {
	private long lastId;

	public IdGenerator(long lastId) {
		this.lastId = lastId;
	}

	public long nextId() {
		lastId += 1;
		return lastId;
	}
}
