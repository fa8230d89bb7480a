package simulator.cache;

/** A named statistic. Counters only go up; nothing resets them during a run. */
public class Counter {
	protected final String name;
	protected long stat;

	Counter(String n) {
		this.name = n;
	}

	public String name() {
		return name;
	}

	public long get() {
		return stat;
	}

	public void incr() {
		stat++;
	}

	@Override
	public String toString() {
		return name + "=" + stat;
	}
}
