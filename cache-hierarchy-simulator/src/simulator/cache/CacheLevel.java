package simulator.cache;

import java.util.ArrayList;
import java.util.List;

import simulator.cache.AddressDecoder.Decoded;

/**
 * A single set-associative, write-back, write-allocate cache. A level serves
 * reads and writes against its own sets only; moving blocks and writebacks
 * between levels is the job of {@link CacheHierarchy}.
 */
public class CacheLevel {

	protected final CacheConfig config;
	protected final Level levelInHierarchy;
	protected final AddressDecoder decoder;
	/** associativity */
	protected final int assoc;

	/** Each set is a fixed array of slots; slot order is not recency order. */
	protected final List<List<CacheLine>> sets;
	/** One replacement ledger per set, parallel to {@code sets} */
	protected final EvictionPolicy[] ledgers;

	final CacheEventCounter stats;

	public interface LineVisitor {
		public void visit(int setIndex, int slot, CacheLine l);
	}

	public CacheLevel(CacheConfig thisConfig) {
		this.config = thisConfig;
		this.levelInHierarchy = thisConfig.level;
		this.assoc = thisConfig.assoc;
		this.decoder = new AddressDecoder(thisConfig);
		this.stats = new CacheEventCounter(levelInHierarchy);

		// construct the cache itself
		int numSets = thisConfig.numSets();
		assert numSets * thisConfig.lineSize * thisConfig.assoc == thisConfig.cacheSize;

		sets = new ArrayList<List<CacheLine>>(numSets);
		ledgers = new EvictionPolicy[numSets];
		for (int i = 0; i < numSets; i++) {
			List<CacheLine> set = new ArrayList<CacheLine>(assoc);
			for (int j = 0; j < assoc; j++) {
				set.add(new CacheLine());
			}
			sets.add(set);
			ledgers[i] = thisConfig.policy.newLedger();
		}
	} // end ctor

	/**
	 * Serve one read or write at this level: a lookup, followed on a miss by a
	 * fill that may evict a block.
	 */
	public AccessResult access(long address, Operation op) {
		AccessResult ret = lookup(address, op);
		if (!ret.hit()) {
			fill(address, op, ret);
		}
		return ret;
	}

	/**
	 * Look the address up and count the hit or miss. A read hit only updates the
	 * replacement ledger; a write hit also marks the line dirty. A miss leaves the
	 * set untouched.
	 */
	public AccessResult lookup(long address, Operation op) {
		Decoded d = decoder.decode(address);
		List<CacheLine> set = sets.get(d.setIndex);
		AccessResult ret = new AccessResult(levelInHierarchy);

		int slot = findSlot(set, d.tag);
		if (slot >= 0) {
			// hit!
			if (op == Operation.WRITE) {
				set.get(slot).setDirty(true);
			}
			ledgers[d.setIndex].touch(slot);
			ret.outcome = Outcome.HIT;
		} else {
			ret.outcome = Outcome.MISS;
		}
		stats.countAccess(op, ret.hit());
		return ret;
	}

	/**
	 * Bring the block containing {@code address} into this level after a miss.
	 * A free slot is used if the set has one; otherwise the policy's victim is
	 * evicted, counting a writeback if it was dirty. The new line is dirty iff
	 * {@code op} is a write. Eviction details are recorded in {@code ret}.
	 */
	void fill(long address, Operation op, AccessResult ret) {
		Decoded d = decoder.decode(address);
		List<CacheLine> set = sets.get(d.setIndex);
		EvictionPolicy ledger = ledgers[d.setIndex];
		assert findSlot(set, d.tag) < 0 : "block " + BitTwiddle.hex(address) + " is already in " + levelInHierarchy;

		int slot = findFreeSlot(set);
		if (slot < 0) {
			// the set is full: evict a line
			assert ledger.size() == assoc : "set " + d.setIndex + " is full but its ledger is " + ledger;
			slot = ledger.chooseVictim();
			CacheLine victim = set.get(slot);
			assert victim.valid();

			ret.evicted = true;
			ret.evictedBlock = decoder.blockAddress(victim.tag(), d.setIndex);
			if (victim.dirty()) {
				ret.writeback = true;
				stats.writebacks.incr();
			}
			stats.evictions.incr();
			ledger.remove(slot);
		}

		// NB: only insert the incoming block *after* the victim has left the ledger
		set.get(slot).fill(d.tag, op == Operation.WRITE);
		ledger.insert(slot);
	}

	/**
	 * The block a fill of {@code address} would evict, or null if the set still
	 * has a free slot. Changes nothing.
	 */
	public Long victimFor(long address) {
		Decoded d = decoder.decode(address);
		List<CacheLine> set = sets.get(d.setIndex);
		if (findFreeSlot(set) >= 0) {
			return null;
		}
		CacheLine victim = set.get(ledgers[d.setIndex].chooseVictim());
		return decoder.blockAddress(victim.tag(), d.setIndex);
	}

	/** True when the block containing {@code address} is resident. */
	public boolean contains(long address) {
		return getLine(address) != null;
	}

	/** True when the block containing {@code address} is resident and dirty. */
	public boolean isDirty(long address) {
		CacheLine line = getLine(address);
		return line != null && line.dirty();
	}

	/**
	 * Accept a writeback of a dirty block from the level above. Inclusion
	 * guarantees the block is resident here. Not counted as an access.
	 */
	void markDirty(long address) {
		CacheLine line = getLine(address);
		if (line == null) {
			throw new IllegalStateException(
					"Cache inclusivity violated: writeback of " + BitTwiddle.hex(address) + " missed in " + levelInHierarchy);
		}
		line.setDirty(true);
	}

	/**
	 * Drop the resident block containing {@code address} because the next level
	 * is evicting it. Counts an invalidation, and a writeback when the block was
	 * dirty.
	 *
	 * @return whether the dropped block was dirty
	 */
	boolean invalidate(long address) {
		Decoded d = decoder.decode(address);
		List<CacheLine> set = sets.get(d.setIndex);
		int slot = findSlot(set, d.tag);
		assert slot >= 0 : BitTwiddle.hex(address) + " is not resident in " + levelInHierarchy;

		CacheLine line = set.get(slot);
		boolean wasDirty = line.dirty();
		if (wasDirty) {
			stats.writebacks.incr();
		}
		stats.invalidations.incr();
		line.invalidate();
		ledgers[d.setIndex].remove(slot);
		return wasDirty;
	}

	/** Just get the line holding the block containing {@code address}, or null. */
	CacheLine getLine(long address) {
		Decoded d = decoder.decode(address);
		List<CacheLine> set = sets.get(d.setIndex);
		int slot = findSlot(set, d.tag);
		return slot < 0 ? null : set.get(slot);
	}

	private static int findSlot(List<CacheLine> set, long tag) {
		for (int i = 0; i < set.size(); i++) {
			if (set.get(i).matches(tag)) {
				return i;
			}
		}
		return -1;
	}

	private static int findFreeSlot(List<CacheLine> set) {
		for (int i = 0; i < set.size(); i++) {
			if (set.get(i).invalid()) {
				return i;
			}
		}
		return -1;
	}

	/** Address of the block held by {@code line}, which must be valid and sit in set {@code setIndex}. */
	public long blockAddress(int setIndex, CacheLine line) {
		return decoder.blockAddress(line.tag(), setIndex);
	}

	/**
	 * Calls the given visitor function once on each line in this cache, valid or
	 * not, set by set in slot order.
	 */
	public void visitAllLines(LineVisitor lv) {
		for (int i = 0; i < sets.size(); i++) {
			List<CacheLine> set = sets.get(i);
			for (int j = 0; j < set.size(); j++) {
				lv.visit(i, j, set.get(j));
			}
		}
	}

	/** The number of valid lines in the set {@code address} maps to. */
	int occupancy(long address) {
		int n = 0;
		for (CacheLine l : sets.get(decoder.decode(address).setIndex)) {
			if (l.valid()) {
				n++;
			}
		}
		return n;
	}

	public CacheConfig config() {
		return config;
	}

	public Level level() {
		return levelInHierarchy;
	}

	public CacheEventCounter stats() {
		return stats;
	}

	public AddressDecoder decoder() {
		return decoder;
	}

	@Override
	public String toString() {
		StringBuilder s = new StringBuilder();
		s.append("cache=" + levelInHierarchy + " (" + config + ")" + System.getProperty("line.separator"));
		for (int i = 0; i < sets.size(); i++) {
			s.append("set " + i + " " + ledgers[i] + System.getProperty("line.separator"));
			for (CacheLine l : sets.get(i)) {
				s.append("  " + l + (l.valid() ? " block=" + BitTwiddle.hex(blockAddress(i, l)) : "")
						+ System.getProperty("line.separator"));
			}
		}
		return s.toString();
	}

} // end class CacheLevel
