package tntc;

/**
 * A tntc exception consisting of a prefix (type of error) and a message
 *
 */
public abstract class TntcException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public TntcException(String prefix, String msg) {
		super(prefix.isEmpty() ? msg : prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}
}
