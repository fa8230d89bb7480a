package simulator.cache;

import java.util.LinkedList;

/**
 * Replacement bookkeeping for a single set. The ledger lists the occupied slots
 * of the set, from the most recently inserted (or, for the recency policies,
 * most recently used) slot at the front to the oldest at the back. Slot numbers
 * are positions in the set and never move; only the ledger is reordered.
 */
abstract class EvictionPolicy {

	protected final LinkedList<Integer> order = new LinkedList<Integer>();

	/** A resident slot was hit by a read or a write. */
	abstract void touch(int slot);

	/**
	 * Pick the slot to evict from a full set. Does not change the ledger; the
	 * caller removes the victim and inserts the incoming block.
	 */
	abstract int chooseVictim();

	/** A block was just placed into {@code slot}. */
	void insert(int slot) {
		assert !order.contains(slot) : "slot " + slot + " is already in the ledger " + order;
		order.addFirst(slot);
	}

	/** The block in {@code slot} left the set, by eviction or invalidation. */
	void remove(int slot) {
		boolean found = order.remove(Integer.valueOf(slot));
		assert found : "slot " + slot + " is not in the ledger " + order;
	}

	boolean contains(int slot) {
		return order.contains(slot);
	}

	/** The number of occupied slots. */
	int size() {
		return order.size();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + order;
	}
}

/** Evicts the block resident longest; hits do not matter. */
class FifoPolicy extends EvictionPolicy {

	@Override
	void touch(int slot) {
		assert order.contains(slot);
	}

	@Override
	int chooseVictim() {
		return order.getLast();
	}
}

/** Evicts the least recently used block. */
class LruPolicy extends EvictionPolicy {

	@Override
	void touch(int slot) {
		// move this slot to the mru spot
		if (order.getFirst() != slot) {
			remove(slot);
			order.addFirst(slot);
		}
	}

	@Override
	int chooseVictim() {
		return order.getLast();
	}
}

/**
 * Evicts the most recently used block. The victim is chosen before the incoming
 * block is inserted, so the incoming block is never its own victim.
 */
class MruPolicy extends LruPolicy {

	@Override
	int chooseVictim() {
		return order.getFirst();
	}
}
