package simulator.cache;

/**
 * What one level of the hierarchy did for one access. Records are created once
 * per level consulted and never change.
 */
public final class EventRecord {
	public final Level level;
	/** The operation as seen by this level; lower levels see block fetches as reads. */
	public final Operation operation;
	public final Outcome outcome;
	/** The accessed byte address */
	public final long address;
	/** This level evicted a block to make room */
	public final boolean evicted;
	/** Block address evicted by this level; 0 when nothing was evicted */
	public final long evictedBlock;
	/** The evicted block was dirty and was written to the next level */
	public final boolean writeback;
	/** The evicted block was also removed from L1 */
	public final boolean invalidatedInL1;
	/** The L1 copy removed with it was dirty, and was written back first */
	public final boolean writebackFromL1;

	/** A record of an access that evicted nothing. */
	EventRecord(Level level, Operation operation, Outcome outcome, long address) {
		this(level, operation, outcome, address, false, 0L, false, false, false);
	}

	/** A record of an access that evicted {@code evictedBlock}. */
	EventRecord(Level level, Operation operation, Outcome outcome, long address, long evictedBlock,
			boolean writeback, boolean invalidatedInL1, boolean writebackFromL1) {
		this(level, operation, outcome, address, true, evictedBlock, writeback, invalidatedInL1, writebackFromL1);
	}

	private EventRecord(Level level, Operation operation, Outcome outcome, long address, boolean evicted,
			long evictedBlock, boolean writeback, boolean invalidatedInL1, boolean writebackFromL1) {
		assert !writebackFromL1 || invalidatedInL1;
		assert !invalidatedInL1 || evicted;
		assert !writeback || evicted;
		this.level = level;
		this.operation = operation;
		this.outcome = outcome;
		this.address = address;
		this.evicted = evicted;
		this.evictedBlock = evicted ? evictedBlock : 0L;
		this.writeback = writeback;
		this.invalidatedInL1 = invalidatedInL1;
		this.writebackFromL1 = writebackFromL1;
	}

	static EventRecord from(AccessResult r, Operation op, long address) {
		return new EventRecord(r.level, op, r.outcome, address, r.evicted, r.evictedBlock, r.writeback,
				r.invalidatedAbove, r.dirtyAbove);
	}

	/** The backing store always has the block. */
	static EventRecord memoryFetch(long address) {
		return new EventRecord(Level.MEMORY, Operation.READ, Outcome.HIT, address);
	}

	public boolean hit() {
		return outcome == Outcome.HIT;
	}

	public boolean evicted() {
		return evicted;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof EventRecord) {
			EventRecord e = (EventRecord) o;
			return level == e.level && operation == e.operation && outcome == e.outcome && address == e.address
					&& evicted == e.evicted && evictedBlock == e.evictedBlock && writeback == e.writeback
					&& invalidatedInL1 == e.invalidatedInL1 && writebackFromL1 == e.writebackFromL1;
		}
		return false;
	}

	@Override
	public int hashCode() {
		int h = level.hashCode();
		h = 31 * h + operation.hashCode();
		h = 31 * h + outcome.hashCode();
		h = 31 * h + Long.hashCode(address);
		h = 31 * h + Long.hashCode(evictedBlock);
		return h;
	}

	@Override
	public String toString() {
		return EventLog.format(this);
	}
}
