package simulator.cache;

/**
 * A cache configuration that cannot be simulated: bad geometry, an unknown
 * token, or levels in the wrong order. Raised before any access is simulated.
 */
public class ConfigException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/** Line of the configuration file, or -1 when the problem is not tied to a line. */
	private final int lineNumber;

	public ConfigException(String message) {
		super(message);
		this.lineNumber = -1;
	}

	public ConfigException(int lineNumber, String message) {
		super("config line " + lineNumber + ": " + message);
		this.lineNumber = lineNumber;
	}

	public int lineNumber() {
		return lineNumber;
	}
}
