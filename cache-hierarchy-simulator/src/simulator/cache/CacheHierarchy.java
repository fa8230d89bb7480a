package simulator.cache;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An inclusive hierarchy of one or two cache levels in front of an infinite
 * backing store. Every block valid in L1 is also valid in L2.
 *
 * On an L1 miss the block is fetched (as a read) from L2, or from memory
 * through L2, and is installed in L2 before it is installed in L1. When L2
 * evicts a block that L1 also holds, L1's copy is invalidated first and its
 * dirty data folded into the block leaving L2. A dirty block evicted from L1
 * is written back into L2.
 */
public class CacheHierarchy {

	/** L1 cache is always present */
	public final CacheLevel L1cache;
	/** L2 cache is optional; null when only one level is configured */
	public final CacheLevel L2cache;

	/**
	 * @param configs one or two level configurations, L1 first
	 */
	public CacheHierarchy(List<CacheConfig> configs) {
		if (configs.isEmpty() || configs.size() > 2) {
			throw new ConfigException("expected one or two cache levels, got " + configs.size());
		}
		if (configs.get(0).level != Level.L1) {
			throw new ConfigException("the first cache level must be L1, got " + configs.get(0).level);
		}
		if (configs.size() == 2 && configs.get(1).level != Level.L2) {
			throw new ConfigException("the second cache level must be L2, got " + configs.get(1).level);
		}
		this.L1cache = new CacheLevel(configs.get(0));
		this.L2cache = configs.size() == 2 ? new CacheLevel(configs.get(1)) : null;
	}

	public boolean useL2() {
		return L2cache != null;
	}

	/** The configured levels, L1 first. */
	public List<CacheLevel> levels() {
		List<CacheLevel> l = new ArrayList<CacheLevel>(2);
		l.add(L1cache);
		if (useL2()) {
			l.add(L2cache);
		}
		return Collections.unmodifiableList(l);
	}

	public List<EventRecord> access(AccessRecord r) {
		return access(r.address, r.operation);
	}

	/**
	 * Run one access through the hierarchy.
	 *
	 * @return one record per level consulted, L1 first, then L2, then memory
	 */
	public List<EventRecord> access(long address, Operation op) {
		List<EventRecord> events = new ArrayList<EventRecord>(3);

		AccessResult l1 = L1cache.lookup(address, op);
		if (l1.hit()) {
			events.add(EventRecord.from(l1, op, address));
			return events;
		}

		// if we made it here, we missed in L1; fetch the block from further down
		List<EventRecord> below = new ArrayList<EventRecord>(2);
		if (useL2()) {
			AccessResult l2 = L2cache.lookup(address, Operation.READ);
			if (!l2.hit()) {
				below.add(EventRecord.memoryFetch(address));
				Long victim = L2cache.victimFor(address);
				if (victim != null) {
					recallFromL1Cache(victim, l2);
				}
				L2cache.fill(address, Operation.READ, l2);
			}
			below.add(0, EventRecord.from(l2, Operation.READ, address));
		} else {
			below.add(EventRecord.memoryFetch(address));
		}

		// the block is now in L2 (if any), so it may enter L1
		L1cache.fill(address, op, l1);
		if (l1.writeback && useL2()) {
			L2cache.markDirty(l1.evictedBlock);
		}

		events.add(EventRecord.from(l1, op, address));
		events.addAll(below);

		assert !useL2() || L2cache.contains(address) : "Cache inclusivity violated";
		return events;
	}

	/**
	 * Called on behalf of L2 before it evicts {@code victim}. The block may not be
	 * in L1, since L1 is usually smaller. A dirty L1 copy is written back into L2
	 * before L2 lets the block go.
	 */
	private void recallFromL1Cache(long victim, AccessResult l2) {
		if (!L1cache.contains(victim)) {
			return;
		}
		boolean dirty = L1cache.invalidate(victim);
		if (dirty) {
			L2cache.markDirty(victim);
		}
		l2.invalidatedAbove = true;
		l2.dirtyAbove = dirty;
	}

	@Override
	public String toString() {
		StringBuilder s = new StringBuilder(L1cache.toString());
		if (useL2()) {
			s.append(L2cache.toString());
		}
		return s.toString();
	}
}
