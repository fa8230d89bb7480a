package simulator.cache;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** The statistics of one cache level. Only the owning CacheLevel increments them. */
public class CacheEventCounter {
	final Level level;

	// counters for cache events
	final Counter readHits;
	final Counter readMisses;
	final Counter writeHits;
	final Counter writeMisses;
	final Counter evictions;
	final Counter writebacks;
	/** blocks removed because the next level evicted them */
	final Counter invalidations;

	private final List<Counter> all = new ArrayList<Counter>();

	CacheEventCounter(Level level) {
		this.level = level;
		readHits = register("ReadHits");
		readMisses = register("ReadMisses");
		writeHits = register("WriteHits");
		writeMisses = register("WriteMisses");
		evictions = register("LineEvictions");
		writebacks = register("Writebacks");
		invalidations = register("BackInvalidations");
	}

	private Counter register(String name) {
		Counter c = new Counter(name);
		all.add(c);
		return c;
	}

	void countAccess(Operation op, boolean hit) {
		if (op == Operation.READ) {
			(hit ? readHits : readMisses).incr();
		} else {
			(hit ? writeHits : writeMisses).incr();
		}
	}

	public Level level() {
		return level;
	}

	public long readHits() {
		return readHits.get();
	}

	public long readMisses() {
		return readMisses.get();
	}

	public long writeHits() {
		return writeHits.get();
	}

	public long writeMisses() {
		return writeMisses.get();
	}

	public long evictions() {
		return evictions.get();
	}

	public long writebacks() {
		return writebacks.get();
	}

	public long invalidations() {
		return invalidations.get();
	}

	public long hits() {
		return readHits() + writeHits();
	}

	public long misses() {
		return readMisses() + writeMisses();
	}

	public long accesses() {
		return hits() + misses();
	}

	/** Hits over accesses; 0 when the level was never accessed. */
	public double hitRate() {
		long n = accesses();
		return n == 0 ? 0.0 : hits() / (double) n;
	}

	public List<Counter> counters() {
		return Collections.unmodifiableList(all);
	}

	/** Write one {@code 'name': value} entry per counter, each wrapped in prefix and suffix. */
	public void dumpCounters(Writer wr, String prefix, String suffix) throws IOException {
		for (Counter c : all) {
			wr.write(prefix + "'level': '" + level.label() + "', '" + c.name + "': " + c.stat + suffix);
		}
	}

	@Override
	public String toString() {
		return level.label() + all;
	}
}
