package simulator.cache;

public enum Outcome {
	HIT("hit"), MISS("miss");

	private final String word;

	private Outcome(String word) {
		this.word = word;
	}

	public String word() {
		return word;
	}
}
