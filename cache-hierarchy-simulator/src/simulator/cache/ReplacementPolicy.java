package simulator.cache;

/** The eviction policies a cache level can be configured with. */
public enum ReplacementPolicy {
	FIFO {
		@Override
		EvictionPolicy newLedger() {
			return new FifoPolicy();
		}
	},
	LRU {
		@Override
		EvictionPolicy newLedger() {
			return new LruPolicy();
		}
	},
	MRU {
		@Override
		EvictionPolicy newLedger() {
			return new MruPolicy();
		}
	};

	/** A fresh, empty ledger for one set. */
	abstract EvictionPolicy newLedger();

	static ReplacementPolicy fromToken(String s) {
		for (ReplacementPolicy p : values()) {
			if (p.name().equalsIgnoreCase(s)) {
				return p;
			}
		}
		return null;
	}
}
