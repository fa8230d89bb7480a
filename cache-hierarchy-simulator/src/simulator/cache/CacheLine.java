package simulator.cache;

/** One slot of a set. A valid line holds exactly one block, identified by its tag. */
class CacheLine {
	protected boolean valid = false;
	protected boolean dirty = false;
	protected long tag;

	public boolean valid() {
		return valid;
	}

	public boolean invalid() {
		return !valid();
	}

	public long tag() {
		assert valid;
		return tag;
	}

	/** True when this line holds the block with the given tag. */
	public boolean matches(long t) {
		return valid && tag == t;
	}

	// Dirty means written since the block was last written back to the next level.
	public boolean dirty() {
		return dirty;
	}

	public void setDirty(boolean status) {
		assert valid || !status : "an invalid line cannot be dirty";
		dirty = status;
	}

	/** Place a new block into this line, replacing whatever it held. */
	void fill(long t, boolean isDirty) {
		this.tag = t;
		this.valid = true;
		this.dirty = isDirty;
	}

	void invalidate() {
		valid = false;
		dirty = false;
	}

	@Override
	public String toString() {
		return (valid ? "tag=" + tag + " valid" : "invalid") + (dirty ? " dirty" : " clean");
	}
}
