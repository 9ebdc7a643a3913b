package velab;

/**
 * An elaboration exception consisting of a prefix (kind of error) and a message.
 */
public abstract class VelabException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public VelabException(String prefix, String msg) {
		super(prefix + ": " + msg);
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
