package simulator.cache;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

public class AccessSimulatorTests {

	static final CacheConfig l1config = new CacheConfig(64, 8, 2, ReplacementPolicy.LRU, Level.L1);
	static final CacheConfig l2config = new CacheConfig(128, 8, 4, ReplacementPolicy.FIFO, Level.L2);

	static List<AccessRecord> trace;

	/** A fixed pseudo-random trace over 64 blocks, a third of it writes. */
	static List<AccessRecord> randomTrace(long seed, int n) {
		Random rng = new Random(seed);
		List<AccessRecord> t = new ArrayList<AccessRecord>(n);
		for (int i = 0; i < n; i++) {
			long address = rng.nextInt(512);
			t.add(rng.nextInt(3) == 0 ? AccessRecord.write(address) : AccessRecord.read(address));
		}
		return t;
	}

	static AccessSimulator newSimulator(boolean xasserts) {
		return new AccessSimulator(new CacheHierarchy(Arrays.asList(l1config, l2config)), xasserts, 1);
	}

	/**
	 * @throws java.lang.Exception
	 */
	@Before
	public void setUp() throws Exception {
		trace = randomTrace(42, 2000);
	}

	@Test
	public void testInvariantsHoldThroughoutRun() {
		// the Verifier throws on the first broken invariant
		AccessSimulator sim = newSimulator(true);
		sim.run(trace);
		assertEquals(trace.size(), sim.accesses());
	}

	@Test
	public void testConservation() {
		AccessSimulator sim = newSimulator(false);
		sim.run(trace);

		long reads = 0, writes = 0;
		for (AccessRecord r : trace) {
			if (r.operation == Operation.READ) {
				reads++;
			} else {
				writes++;
			}
		}
		assertEquals(reads, sim.reads());
		assertEquals(writes, sim.writes());

		CacheEventCounter l1 = sim.statistics().get(0);
		CacheEventCounter l2 = sim.statistics().get(1);
		assertEquals(reads, l1.readHits() + l1.readMisses());
		assertEquals(writes, l1.writeHits() + l1.writeMisses());
		assertEquals(l1.misses(), l2.readHits() + l2.readMisses());
		assertEquals(0, l2.writeHits() + l2.writeMisses());
	}

	@Test
	public void testOneRecordPerLevelConsulted() {
		AccessSimulator sim = newSimulator(false);
		int expected = 0;
		for (AccessRecord r : trace) {
			List<EventRecord> events = sim.step(r);
			assertEquals(Level.L1, events.get(0).level);
			assertEquals(r.operation, events.get(0).operation);
			for (int i = 1; i < events.size(); i++) {
				assertEquals(Operation.READ, events.get(i).operation);
				assertTrue(events.get(i - 1).level.compareTo(events.get(i).level) < 0);
				assertFalse(events.get(i - 1).hit());
			}
			assertTrue(events.get(events.size() - 1).hit());
			expected += events.size();
		}
		assertEquals(expected, sim.log().size());
	}

	@Test
	public void testDeterminism() {
		AccessSimulator first = newSimulator(false);
		AccessSimulator second = newSimulator(false);
		first.run(trace);
		second.run(randomTrace(42, 2000));

		assertEquals(first.log(), second.log());
		for (int i = 0; i < 2; i++) {
			CacheEventCounter a = first.statistics().get(i);
			CacheEventCounter b = second.statistics().get(i);
			assertEquals(a.toString(), b.toString());
		}

		StringWriter one = new StringWriter();
		StringWriter two = new StringWriter();
		EventLog.printSummary(new PrintWriter(one), first);
		EventLog.printSummary(new PrintWriter(two), second);
		assertEquals(one.toString(), two.toString());
	}

	/** Collect the dirty blocks of a level. */
	static Set<Long> dirtyBlocks(final CacheLevel cache) {
		final Set<Long> dirty = new HashSet<Long>();
		cache.visitAllLines(new CacheLevel.LineVisitor() {
			@Override
			public void visit(int setIndex, int slot, CacheLine l) {
				if (l.valid() && l.dirty()) {
					dirty.add(cache.blockAddress(setIndex, l));
				}
			}
		});
		return dirty;
	}

	@Test
	public void testEvictionImpliesFullSet() {
		AccessSimulator sim = newSimulator(false);
		CacheHierarchy h = sim.hierarchy();
		int evictions = 0;
		for (AccessRecord r : trace) {
			int l1Before = h.L1cache.occupancy(r.address);
			int l2Before = h.L2cache.occupancy(r.address);
			for (EventRecord e : sim.step(r)) {
				if (e.evicted()) {
					evictions++;
					if (e.level == Level.L1) {
						assertEquals(l1config.assoc, l1Before);
					} else {
						assertEquals(Level.L2, e.level);
						assertEquals(l2config.assoc, l2Before);
					}
				}
			}
		}
		assertTrue(evictions > 0);
	}

	@Test
	public void testWritebackImpliesDirty() {
		AccessSimulator sim = newSimulator(false);
		CacheHierarchy h = sim.hierarchy();
		int writebacks = 0;
		for (AccessRecord r : trace) {
			Set<Long> l1Dirty = dirtyBlocks(h.L1cache);
			Set<Long> l2Dirty = dirtyBlocks(h.L2cache);
			for (EventRecord e : sim.step(r)) {
				if (!e.evicted()) {
					continue;
				}
				if (e.level == Level.L1) {
					assertEquals(l1Dirty.contains(e.evictedBlock), e.writeback);
				} else {
					assertEquals(l1Dirty.contains(e.evictedBlock), e.writebackFromL1);
					assertEquals(l2Dirty.contains(e.evictedBlock) || e.writebackFromL1, e.writeback);
				}
				if (e.writeback) {
					writebacks++;
				}
			}
		}
		assertTrue(writebacks > 0);
		long counted = 0;
		for (CacheEventCounter s : sim.statistics()) {
			counted += s.writebacks();
		}
		// back-invalidated dirty L1 copies are counted at L1 too
		assertTrue(counted >= writebacks);
	}

	@Test
	public void testListenerSeesEveryRecord() {
		AccessSimulator sim = newSimulator(false);
		final List<EventRecord> seen = new ArrayList<EventRecord>();
		sim.setListener(new EventListener() {
			@Override
			public void onEvent(EventRecord e) {
				seen.add(e);
			}
		});
		sim.run(trace.subList(0, 100));
		assertEquals(sim.log(), seen);
	}

	@Test
	public void testAssertPeriod() {
		AccessSimulator sim = new AccessSimulator(new CacheHierarchy(Arrays.asList(l1config, l2config)), true, 50);
		sim.run(trace);
		assertEquals(2000, sim.accesses());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testBadAssertPeriod() {
		new AccessSimulator(new CacheHierarchy(Arrays.asList(l1config, l2config)), true, 0);
	}
}
