package simulator.cache;

/**
 * The geometry and policies of one cache level. Instances are validated on
 * construction and never change afterwards.
 */
public class CacheConfig {
	/** total capacity in bytes */
	public final int cacheSize;
	/** block (line) size in bytes; a power of two */
	public final int lineSize;
	/** lines per set */
	public final int assoc;
	public final ReplacementPolicy policy;
	public final WritePolicy writePolicy;
	public final Level level;

	public CacheConfig(int cacheSize, int lineSize, int assoc, ReplacementPolicy policy, Level level) {
		this(cacheSize, lineSize, assoc, policy, WritePolicy.WRITE_BACK, level);
	}

	public CacheConfig(int cacheSize, int lineSize, int assoc, ReplacementPolicy policy, WritePolicy writePolicy,
			Level level) {
		if (cacheSize <= 0 || lineSize <= 0 || assoc <= 0) {
			throw new ConfigException("cache size, block size and associativity must be positive (got " + cacheSize
					+ " " + lineSize + " " + assoc + ")");
		}
		if (!BitTwiddle.isPowerOf2(lineSize)) {
			throw new ConfigException("block size " + lineSize + " is not a power of two");
		}
		if (cacheSize % lineSize != 0) {
			throw new ConfigException("cache size " + cacheSize + " is not a multiple of block size " + lineSize);
		}
		if ((cacheSize / lineSize) % assoc != 0) {
			throw new ConfigException(
					(cacheSize / lineSize) + " blocks cannot be split into sets of " + assoc + " lines");
		}
		if (policy == null || writePolicy == null) {
			throw new ConfigException("replacement and write policies are required");
		}
		if (level == null || level == Level.MEMORY) {
			throw new ConfigException("a cache level must be L1 or L2, not " + level);
		}
		this.cacheSize = cacheSize;
		this.lineSize = lineSize;
		this.assoc = assoc;
		this.policy = policy;
		this.writePolicy = writePolicy;
		this.level = level;
	}

	public int numLines() {
		return cacheSize / lineSize;
	}

	public int numSets() {
		return cacheSize / (lineSize * assoc);
	}

	/** Renders the configuration in the same form the configuration file uses. */
	@Override
	public String toString() {
		return cacheSize + " " + lineSize + " " + assoc + " " + policy + " " + writePolicy.token() + " "
				+ level.label();
	}
}
