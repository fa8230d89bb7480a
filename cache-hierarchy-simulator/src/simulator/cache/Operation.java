package simulator.cache;

public enum Operation {
	READ("R", "read"), WRITE("W", "write");

	private final String token;
	private final String verb;

	private Operation(String token, String verb) {
		this.token = token;
		this.verb = verb;
	}

	/** The single-letter form used in trace files. */
	public String token() {
		return token;
	}

	/** The lower-case form used in the event log. */
	public String verb() {
		return verb;
	}

	/**
	 * Parse a trace operation: the letter form ({@code R}, {@code W}) or the full
	 * word, in any case. Returns null for anything else.
	 */
	static Operation fromToken(String s) {
		for (Operation op : values()) {
			if (op.token.equalsIgnoreCase(s) || op.verb.equalsIgnoreCase(s) || op.name().equalsIgnoreCase(s)) {
				return op;
			}
		}
		return null;
	}
}
