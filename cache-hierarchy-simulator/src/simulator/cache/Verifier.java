package simulator.cache;

import java.util.HashSet;
import java.util.Set;

/**
 * Expensive consistency checks over the whole hierarchy. Each check throws a
 * RuntimeException describing the first violation it finds.
 */
class Verifier {

	private final CacheHierarchy hierarchy;

	Verifier(CacheHierarchy hierarchy) {
		this.hierarchy = hierarchy;
	}

	/**
	 * Run every check.
	 *
	 * @param reads  reads issued to the hierarchy so far
	 * @param writes writes issued to the hierarchy so far
	 */
	void verifyAll(long reads, long writes) {
		for (CacheLevel c : hierarchy.levels()) {
			verifyLedgers(c);
		}
		verifyInclusivity();
		verifyConservation(reads, writes);
	}

	/** Every valid L1 block must be valid in L2. */
	void verifyInclusivity() {
		if (!hierarchy.useL2()) {
			return;
		}
		final CacheLevel l1 = hierarchy.L1cache;
		final CacheLevel l2 = hierarchy.L2cache;
		l1.visitAllLines(new CacheLevel.LineVisitor() {
			@Override
			public void visit(int setIndex, int slot, CacheLine line) {
				if (line.valid()) {
					long block = l1.blockAddress(setIndex, line);
					if (!l2.contains(block)) {
						throw new RuntimeException("L1 and L2 inclusivity is violated for block " + BitTwiddle.hex(block));
					}
				}
			}
		});
	}

	/** The replacement ledger of every set lists exactly the set's valid slots. */
	void verifyLedgers(CacheLevel cache) {
		for (int i = 0; i < cache.sets.size(); i++) {
			Set<Integer> validSlots = new HashSet<Integer>();
			for (int j = 0; j < cache.assoc; j++) {
				if (cache.sets.get(i).get(j).valid()) {
					validSlots.add(j);
				}
			}
			EvictionPolicy ledger = cache.ledgers[i];
			if (ledger.size() != validSlots.size()) {
				throw new RuntimeException(cache.level() + " set " + i + ": ledger " + ledger + " but valid slots "
						+ validSlots);
			}
			for (Integer slot : validSlots) {
				if (!ledger.contains(slot)) {
					throw new RuntimeException(cache.level() + " set " + i + ": valid slot " + slot
							+ " missing from ledger " + ledger);
				}
			}
			if (ledger.size() > cache.assoc) {
				throw new RuntimeException(cache.level() + " set " + i + " is overfull");
			}
		}
	}

	/**
	 * Hits plus misses at each level equal the accesses that reached it: all
	 * reads and writes at L1, one read per L1 miss at L2.
	 */
	void verifyConservation(long reads, long writes) {
		CacheEventCounter l1 = hierarchy.L1cache.stats();
		if (l1.readHits() + l1.readMisses() != reads) {
			throw new RuntimeException("L1 counted " + (l1.readHits() + l1.readMisses()) + " reads, expected " + reads);
		}
		if (l1.writeHits() + l1.writeMisses() != writes) {
			throw new RuntimeException(
					"L1 counted " + (l1.writeHits() + l1.writeMisses()) + " writes, expected " + writes);
		}
		if (hierarchy.useL2()) {
			CacheEventCounter l2 = hierarchy.L2cache.stats();
			if (l2.accesses() != l1.misses() || l2.writeHits() + l2.writeMisses() != 0) {
				throw new RuntimeException("L2 saw " + l2.accesses() + " accesses for " + l1.misses() + " L1 misses");
			}
		}
		for (CacheLevel c : hierarchy.levels()) {
			CacheEventCounter s = c.stats();
			if (s.evictions() > s.misses()) {
				throw new RuntimeException(c.level() + " evicted more blocks than it missed");
			}
			if (s.writebacks() > s.evictions() + s.invalidations()) {
				throw new RuntimeException(c.level() + " wrote back more blocks than it dropped");
			}
		}
	}
}
