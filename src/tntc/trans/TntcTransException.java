package tntc.trans;

import tntc.TntcException;

/**
 * Exception during name resolution, import resolution or flattening of TNT modules
 *
 */
public class TntcTransException extends TntcException {

	private static final long serialVersionUID = 4431067715270927183L;
	private static final String prefix = "Resolution Error";

	public TntcTransException(String msg) {
		super(prefix, msg);
	}

	protected TntcTransException(String prefix, String msg) {
		super(prefix, msg);
	}

}
