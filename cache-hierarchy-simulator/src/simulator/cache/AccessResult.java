package simulator.cache;

/** The response of one cache level to a lookup, and to the fill that follows a miss. */
class AccessResult {
	/** The level that produced this result */
	public final Level level;
	public Outcome outcome;
	/** The fill displaced a valid block */
	public boolean evicted;
	/** Address of the block the fill evicted; meaningful only when {@code evicted} */
	public long evictedBlock;
	/** The evicted block was dirty and had to be written to the next level */
	public boolean writeback;
	/** The evicted block was also resident in L1 and was invalidated there */
	public boolean invalidatedAbove;
	/** The L1 copy invalidated along with the evicted block was dirty */
	public boolean dirtyAbove;

	AccessResult(Level level) {
		this.level = level;
	}

	public boolean hit() {
		return outcome == Outcome.HIT;
	}

	public boolean evicted() {
		return evicted;
	}

	@Override
	public String toString() {
		return level + " " + outcome + (evicted ? " evicted=" + BitTwiddle.hex(evictedBlock) : "")
				+ (writeback ? " writeback" : "");
	}
}
