package simulator.cache;

/** A malformed trace record. The whole run is abandoned. */
public class TraceException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int lineNumber;

	public TraceException(int lineNumber, String message) {
		super("trace line " + lineNumber + ": " + message);
		this.lineNumber = lineNumber;
	}

	public int lineNumber() {
		return lineNumber;
	}
}
