package simulator.cache;

/**
 * Splits a byte address into (tag, set index, block offset) for one cache
 * geometry. The number of sets need not be a power of two, so decoding uses
 * division rather than bit masks.
 */
public final class AddressDecoder {

	/** The three fields of a decoded address. */
	public static final class Decoded {
		public final long tag;
		public final int setIndex;
		public final int offset;

		Decoded(long tag, int setIndex, int offset) {
			this.tag = tag;
			this.setIndex = setIndex;
			this.offset = offset;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Decoded) {
				Decoded other = (Decoded) o;
				return tag == other.tag && setIndex == other.setIndex && offset == other.offset;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return (int) (tag * 31 + setIndex) * 31 + offset;
		}

		@Override
		public String toString() {
			return "tag=" + tag + " set=" + setIndex + " offset=" + offset;
		}
	}

	private final int lineSize;
	private final int numSets;

	public AddressDecoder(CacheConfig config) {
		this.lineSize = config.lineSize;
		this.numSets = config.numSets();
	}

	public static Decoded decode(long address, CacheConfig config) {
		return new AddressDecoder(config).decode(address);
	}

	/** Addresses are unsigned 64-bit values. */
	public Decoded decode(long address) {
		long block = Long.divideUnsigned(address, lineSize);
		return new Decoded(Long.divideUnsigned(block, numSets), (int) Long.remainderUnsigned(block, numSets),
				(int) Long.remainderUnsigned(address, lineSize));
	}

	/** The first byte of the block with the given tag in the given set. */
	public long blockAddress(long tag, int setIndex) {
		return (tag * numSets + setIndex) * lineSize;
	}

	/** Clears the offset bits. */
	public long blockAlign(long address) {
		return address - Long.remainderUnsigned(address, lineSize);
	}
}
