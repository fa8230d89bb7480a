package simulator.cache;

import java.io.PrintWriter;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Renders event records and the end-of-run summary as text. One record becomes
 * one line:
 *
 * <pre>
 * L1: write miss at address 0x40, evicted 0x0 (writeback)
 * </pre>
 */
public class EventLog implements EventListener {

	private final PrintWriter out;

	public EventLog(PrintWriter out) {
		this.out = out;
	}

	@Override
	public void onEvent(EventRecord e) {
		out.println(format(e));
	}

	public static String format(EventRecord e) {
		StringBuilder s = new StringBuilder();
		s.append(e.level.label()).append(": ").append(e.operation.verb()).append(' ').append(e.outcome.word())
				.append(" at address ").append(BitTwiddle.hex(e.address));
		if (e.evicted()) {
			s.append(", evicted ").append(BitTwiddle.hex(e.evictedBlock));
			String notes = "";
			if (e.writebackFromL1) {
				notes += "writeback from L1, ";
			}
			if (e.invalidatedInL1) {
				notes += "invalidated in L1, ";
			}
			if (e.writeback) {
				notes += "writeback, ";
			}
			if (!notes.isEmpty()) {
				s.append(" (").append(notes, 0, notes.length() - 2).append(')');
			}
		}
		return s.toString();
	}

	/** Print the per-level statistics, L1 first. */
	public static void printSummary(PrintWriter out, AccessSimulator sim) {
		DecimalFormat fmt = new DecimalFormat("0.000", DecimalFormatSymbols.getInstance(Locale.ROOT));
		boolean twoLevels = sim.hierarchy().useL2();
		for (CacheEventCounter s : sim.statistics()) {
			out.println(s.level().label() + " statistics:");
			out.println("  read hits: " + s.readHits());
			out.println("  read misses: " + s.readMisses());
			out.println("  write hits: " + s.writeHits());
			out.println("  write misses: " + s.writeMisses());
			out.println("  hit rate: " + fmt.format(s.hitRate()));
			out.println("  evictions: " + s.evictions());
			out.println("  writebacks: " + s.writebacks());
			if (twoLevels && s.level() == Level.L1) {
				out.println("  back-invalidations: " + s.invalidations());
			}
		}
	}
}
