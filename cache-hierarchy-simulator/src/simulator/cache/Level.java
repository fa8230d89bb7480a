package simulator.cache;

/** Where in the hierarchy an event happened. MEMORY is the backing store. */
public enum Level {
	L1("L1"), L2("L2"), MEMORY("Memory");

	private final String label;

	private Level(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}

	/** Parse a level label from a configuration file. The backing store is not configurable. */
	static Level fromToken(String token) {
		for (Level l : values()) {
			if (l != MEMORY && l.label.equalsIgnoreCase(token)) {
				return l;
			}
		}
		return null;
	}
}
