package simulator.cache;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.List;
import java.util.Locale;

import joptsimple.OptionException;
import joptsimple.OptionSet;

/**
 * Command-line front end: loads a configuration and a trace, simulates the
 * trace, and prints the event log followed by the statistics.
 *
 * <pre>
 * CacheSim &lt;config&gt; -t &lt;trace&gt; [--stats-file f] [--quiet] [--xasserts=true]
 * </pre>
 */
public class CacheSim {

	static final String prix = "[cachesim] ";

	static final int EXIT_OK = 0;
	static final int EXIT_BAD_INPUT = 1;
	static final int EXIT_USAGE = 2;

	static OptionSet Options;

	public static void main(String[] args) throws IOException {
		PrintWriter out = new PrintWriter(System.out);
		PrintWriter err = new PrintWriter(System.err, true);
		int status = run(args, out, err);
		out.flush();
		if (status != EXIT_OK) {
			System.exit(status);
		}
	}

	/**
	 * Everything main() does, minus the exit.
	 *
	 * @return the process exit status
	 */
	static int run(String[] args, PrintWriter out, PrintWriter err) throws IOException {
		try {
			Options = Knobs.parser.parse(args);
		} catch (OptionException oe) {
			err.println(prix + oe.getMessage());
			Knobs.parser.printHelpOn(err);
			return EXIT_USAGE;
		}
		if (Options.has(Knobs.Help)) {
			Knobs.parser.printHelpOn(out);
			return EXIT_OK;
		}

		String configName = configFile();
		if (configName == null || !Options.has(Knobs.Trace)) {
			err.println(prix + "usage: CacheSim <config> -t <trace>");
			Knobs.parser.printHelpOn(err);
			return EXIT_USAGE;
		}
		if (Options.valueOf(Knobs.AssertPeriod) < 1) {
			err.println(prix + "--assert-period must be positive");
			return EXIT_USAGE;
		}

		final List<CacheConfig> configs;
		final List<AccessRecord> trace;
		final CacheHierarchy hierarchy;
		try {
			configs = ConfigParser.parse(new File(configName));
			hierarchy = new CacheHierarchy(configs);
			trace = TraceReader.read(new File(Options.valueOf(Knobs.Trace)));
		} catch (ConfigException ce) {
			err.println(prix + "bad configuration " + configName + ": " + ce.getMessage());
			return EXIT_BAD_INPUT;
		} catch (TraceException te) {
			err.println(prix + "bad trace " + Options.valueOf(Knobs.Trace) + ": " + te.getMessage());
			return EXIT_BAD_INPUT;
		} catch (IOException ioe) {
			err.println(prix + "cannot read input: " + ioe.getMessage());
			return EXIT_BAD_INPUT;
		}

		final long startTime = System.currentTimeMillis();
		AccessSimulator sim = new AccessSimulator(hierarchy, Options.valueOf(Knobs.Xasserts),
				Options.valueOf(Knobs.AssertPeriod));
		if (!Options.has(Knobs.Quiet)) {
			sim.setListener(new EventLog(out));
		}

		err.println(prix + "starting simulation of " + trace.size() + " accesses...");
		sim.run(trace);
		EventLog.printSummary(out, sim);
		out.flush();

		double mins = (System.currentTimeMillis() - startTime) / (double) (1000 * 60);
		if (Options.has(Knobs.StatsFile)) {
			try {
				generateStats(mins, sim, configName, new File(Options.valueOf(Knobs.StatsFile)));
			} catch (IOException ioe) {
				err.println(prix + "cannot write stats file " + Options.valueOf(Knobs.StatsFile) + ": " + ioe);
				return EXIT_BAD_INPUT;
			}
		}
		err.println(prix + "finished");
		return EXIT_OK;
	} // end run()

	/** The configuration file, given with --config or as the first plain argument. */
	static String configFile() {
		if (Options.has(Knobs.Config)) {
			return Options.valueOf(Knobs.Config);
		}
		List<?> rest = Options.nonOptionArguments();
		return rest.isEmpty() ? null : String.valueOf(rest.get(0));
	}

	static void generateStats(double simRuntimeMins, AccessSimulator sim, String configName, File f)
			throws IOException {
		try (BufferedWriter statsFd = Files.newBufferedWriter(f.toPath(), StandardCharsets.UTF_8)) {
			dumpStats(statsFd, simRuntimeMins, sim, configName);
		}
	}

	/** Each stat is dumped as a Python dictionary object, one per line. */
	static void dumpStats(Writer statsFd, double simRuntimeMins, AccessSimulator sim, String configName)
			throws IOException {
		StringWriter prefix = new StringWriter();
		prefix.write("{'CacheSimStat': True, 'Config': '" + configName + "', ");
		Knobs.dumpRegisteredParams(prefix);

		String suffix = "}" + System.getProperty("line.separator");

		// dump stats from the caches
		DecimalFormat fmt = new DecimalFormat("0.000", DecimalFormatSymbols.getInstance(Locale.ROOT));
		for (CacheEventCounter s : sim.statistics()) {
			s.dumpCounters(statsFd, prefix.toString(), suffix);
			statsFd.write(prefix.toString() + "'level': '" + s.level().label() + "', 'HitRate': "
					+ fmt.format(s.hitRate()) + suffix);
		}

		// dump "global" stats
		statsFd.write(prefix.toString() + "'" + sim.totalReads.name() + "': " + sim.reads() + suffix);
		statsFd.write(prefix.toString() + "'" + sim.totalWrites.name() + "': " + sim.writes() + suffix);
		statsFd.write(prefix.toString() + "'" + sim.totalAccesses.name() + "': " + sim.accesses() + suffix);
		statsFd.write(
				prefix.toString() + "'SimulationRunningTimeMins': " + String.format(Locale.ROOT, "%.2f", simRuntimeMins) + suffix);
	}
}
