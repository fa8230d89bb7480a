package simulator.cache;

/**
 * How writes reach the next level. Only write-back (with write-allocate on a
 * miss) is modeled.
 */
public enum WritePolicy {
	WRITE_BACK("WB");

	private final String token;

	private WritePolicy(String token) {
		this.token = token;
	}

	public String token() {
		return token;
	}

	static WritePolicy fromToken(String s) {
		for (WritePolicy wp : values()) {
			if (wp.token.equalsIgnoreCase(s)) {
				return wp;
			}
		}
		return null;
	}
}
