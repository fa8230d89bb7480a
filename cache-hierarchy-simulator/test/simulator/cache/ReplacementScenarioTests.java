package simulator.cache;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Collections;
import java.util.List;

import org.junit.Test;

/**
 * The three policies on a "16 4 2 * WB L1" cache: 2 sets of 2 lines, 4-byte
 * blocks. A, B, C and D are blocks 0, 2, 4 and 6, which all map to set 0.
 */
public class ReplacementScenarioTests {

	static final long A = 0x0L;
	static final long B = 0x8L;
	static final long C = 0x10L;
	static final long D = 0x18L;

	private static CacheHierarchy hierarchy(ReplacementPolicy p) {
		return new CacheHierarchy(Collections.singletonList(new CacheConfig(16, 4, 2, p, Level.L1)));
	}

	private static EventRecord l1(List<EventRecord> events) {
		assertEquals(Level.L1, events.get(0).level);
		return events.get(0);
	}

	@Test
	public void testFifoEvictsOldestDespiteHits() {
		CacheHierarchy h = hierarchy(ReplacementPolicy.FIFO);
		h.access(A, Operation.READ);
		h.access(B, Operation.READ);
		assertTrue(l1(h.access(A, Operation.READ)).hit());

		EventRecord c = l1(h.access(C, Operation.READ));
		assertFalse(c.hit());
		assertEquals(A, c.evictedBlock);

		assertTrue(l1(h.access(B, Operation.READ)).hit());
		// B arrived before C, so B goes next
		assertEquals(B, l1(h.access(A, Operation.READ)).evictedBlock);
	}

	@Test
	public void testLruEvictsLeastRecentlyUsed() {
		CacheHierarchy h = hierarchy(ReplacementPolicy.LRU);
		h.access(A, Operation.READ);
		h.access(B, Operation.READ);
		assertTrue(l1(h.access(A, Operation.READ)).hit());

		EventRecord c = l1(h.access(C, Operation.READ));
		assertEquals(B, c.evictedBlock);
		assertTrue(l1(h.access(A, Operation.READ)).hit());
		assertFalse(h.L1cache.contains(B));
	}

	@Test
	public void testLruWriteHitCountsAsUse() {
		CacheHierarchy h = hierarchy(ReplacementPolicy.LRU);
		h.access(A, Operation.READ);
		h.access(B, Operation.READ);
		h.access(A, Operation.WRITE);

		EventRecord c = l1(h.access(C, Operation.READ));
		assertEquals(B, c.evictedBlock);
		assertFalse(c.writeback);
	}

	@Test
	public void testMruEvictsMostRecentlyUsed() {
		CacheHierarchy h = hierarchy(ReplacementPolicy.MRU);
		h.access(A, Operation.READ);
		h.access(B, Operation.READ);
		assertTrue(l1(h.access(B, Operation.READ)).hit());

		EventRecord c = l1(h.access(C, Operation.READ));
		assertEquals(B, c.evictedBlock);
		assertTrue(l1(h.access(A, Operation.READ)).hit());

		// A was just used, so it is the victim for D rather than C
		assertEquals(A, l1(h.access(D, Operation.READ)).evictedBlock);
		assertTrue(h.L1cache.contains(C));
	}

	@Test
	public void testMruNeverEvictsIncomingBlock() {
		CacheHierarchy h = hierarchy(ReplacementPolicy.MRU);
		h.access(A, Operation.READ);
		h.access(B, Operation.READ);
		h.access(C, Operation.READ);
		assertTrue(h.L1cache.contains(C));
		assertTrue(l1(h.access(C, Operation.READ)).hit());
	}

	@Test
	public void testOtherSetUnaffected() {
		for (ReplacementPolicy p : ReplacementPolicy.values()) {
			CacheHierarchy h = hierarchy(p);
			// block 1 maps to set 1
			h.access(0x4L, Operation.WRITE);
			h.access(A, Operation.READ);
			h.access(B, Operation.READ);
			h.access(C, Operation.READ);
			h.access(D, Operation.READ);
			assertTrue(p.toString(), h.L1cache.contains(0x4L));
			assertTrue(p.toString(), h.L1cache.isDirty(0x4L));
		}
	}
}
