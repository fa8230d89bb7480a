package simulator.cache;

/** Receives each event record as soon as the simulator produces it. */
public interface EventListener {
	void onEvent(EventRecord e);
}
