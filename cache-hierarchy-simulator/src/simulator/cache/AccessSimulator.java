package simulator.cache;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Drives a hierarchy over a trace, strictly in order and one access at a time,
 * and keeps the log of every event produced.
 */
public class AccessSimulator {

	private final CacheHierarchy hierarchy;
	private final Verifier verify;
	/** enable checking of computationally expensive asserts */
	private final boolean xasserts;
	private final int assertPeriod;

	private final List<EventRecord> log = new ArrayList<EventRecord>();
	private EventListener listener;

	final Counter totalReads = new Counter("TotalDataReads");
	final Counter totalWrites = new Counter("TotalDataWrites");
	final Counter totalAccesses = new Counter("TotalMemoryAccesses");

	public AccessSimulator(CacheHierarchy hierarchy) {
		this(hierarchy, false, 1);
	}

	/**
	 * @param xasserts     run the Verifier while simulating
	 * @param assertPeriod run it after every this many accesses
	 */
	public AccessSimulator(CacheHierarchy hierarchy, boolean xasserts, int assertPeriod) {
		if (assertPeriod < 1) {
			throw new IllegalArgumentException("assert period must be positive, got " + assertPeriod);
		}
		this.hierarchy = hierarchy;
		this.verify = new Verifier(hierarchy);
		this.xasserts = xasserts;
		this.assertPeriod = assertPeriod;
	}

	/** Also hand each record to {@code l} as it is produced. */
	public void setListener(EventListener l) {
		this.listener = l;
	}

	/** Simulate every access of the trace, in order. */
	public void run(Iterable<AccessRecord> trace) {
		for (AccessRecord r : trace) {
			step(r);
		}
	}

	/** Simulate a single access and return the records it produced. */
	public List<EventRecord> step(AccessRecord r) {
		List<EventRecord> events = hierarchy.access(r);
		(r.operation == Operation.READ ? totalReads : totalWrites).incr();
		totalAccesses.incr();

		log.addAll(events);
		if (listener != null) {
			for (EventRecord e : events) {
				listener.onEvent(e);
			}
		}

		if (enableXasserts()) {
			verify.verifyAll(totalReads.get(), totalWrites.get());
		}
		return events;
	}

	// These checks are expensive
	private boolean enableXasserts() {
		return xasserts && totalAccesses.get() % assertPeriod == 0;
	}

	public CacheHierarchy hierarchy() {
		return hierarchy;
	}

	/** Every record produced so far, in order. */
	public List<EventRecord> log() {
		return Collections.unmodifiableList(log);
	}

	/** Per-level statistics, L1 first. */
	public List<CacheEventCounter> statistics() {
		List<CacheEventCounter> l = new ArrayList<CacheEventCounter>(2);
		for (CacheLevel c : hierarchy.levels()) {
			l.add(c.stats());
		}
		return l;
	}

	public long accesses() {
		return totalAccesses.get();
	}

	public long reads() {
		return totalReads.get();
	}

	public long writes() {
		return totalWrites.get();
	}
}
