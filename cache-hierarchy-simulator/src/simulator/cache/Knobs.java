package simulator.cache;

import java.io.IOException;
import java.io.Writer;
import java.util.Arrays;
import java.util.LinkedList;
import java.util.List;
import java.util.StringTokenizer;

import joptsimple.OptionParser;
import joptsimple.OptionSpec;

public class Knobs {

	public static final OptionSpec<Boolean> Help;
	public static final OptionSpec<Boolean> Xasserts;
	public static final OptionSpec<Integer> AssertPeriod;
	public static final OptionSpec<String> StatsFile;

	public static final OptionSpec<String> Config;
	public static final OptionSpec<String> Trace;
	public static final OptionSpec<Void> Quiet;

	public static final OptionParser parser;

	private Knobs() {
	}

	static {
		parser = new OptionParser();
		BooleanParameters = new LinkedList<OptionSpec<Boolean>>();
		StringParameters = new LinkedList<OptionSpec<String>>();
		IntegerParameters = new LinkedList<OptionSpec<Integer>>();

		Help = parser.accepts("help", "print this help message").withOptionalArg().ofType(Boolean.class)
				.defaultsTo(false);
		Xasserts = registerBool(parser.accepts("xasserts", "enable eXpensive invariant checks").withRequiredArg()
				.ofType(Boolean.class).defaultsTo(false));
		AssertPeriod = registerInt(parser.accepts("assert-period", "run the expensive checks every so many accesses")
				.withRequiredArg().ofType(Integer.class).defaultsTo(1));
		StatsFile = parser.accepts("stats-file", "stats file to generate").withRequiredArg();

		// inputs
		Config = parser
				.accepts("config", "cache configuration file, one '<size> <block> <assoc> <policy> WB <level>' per line")
				.withRequiredArg();
		Trace = registerString(parser.acceptsAll(Arrays.asList("t", "trace"), "trace file, one '<R|W> <address>' per line")
				.withRequiredArg());

		Quiet = parser.accepts("quiet", "print only the summary, not the per-access log");
	}

	/*
	 * Below is the stuff that automatically allows certain flags ("registered"
	 * ones) to appear in the stats output, without any additional effort.
	 */

	private static final List<OptionSpec<Boolean>> BooleanParameters;
	private static final List<OptionSpec<String>> StringParameters;
	private static final List<OptionSpec<Integer>> IntegerParameters;

	private static OptionSpec<String> registerString(OptionSpec<String> o) {
		StringParameters.add(o);
		return o;
	}

	private static OptionSpec<Integer> registerInt(OptionSpec<Integer> o) {
		IntegerParameters.add(o);
		return o;
	}

	private static OptionSpec<Boolean> registerBool(OptionSpec<Boolean> o) {
		BooleanParameters.add(o);
		return o;
	}

	static String format(String flag) {
		// strip brackets
		String noBrackets = flag.replaceAll("\\[", "").replaceAll("\\]", "");

		// options with aliases render as "[t, trace]"; keep the long name
		String[] names = noBrackets.split(",\\s*");
		String longest = names[0];
		for (String n : names) {
			if (n.length() > longest.length()) {
				longest = n;
			}
		}

		// tokenize on dashes
		String result = "";
		StringTokenizer tok = new StringTokenizer(longest, "-");
		while (tok.hasMoreTokens()) {
			String t = tok.nextToken();
			// capitalize each token
			result += (t.substring(0, 1).toUpperCase() + t.substring(1));
		}

		return result;
	}

	public static void dumpRegisteredParams(Writer w) throws IOException {
		for (OptionSpec<Boolean> osb : BooleanParameters) {
			String value = CacheSim.Options.valueOf(osb) ? "True" : "False";
			w.write("'" + format(osb.toString()) + "': " + value + ", ");
		}
		for (OptionSpec<String> os : StringParameters) {
			w.write("'" + format(os.toString()) + "': '" + CacheSim.Options.valueOf(os) + "', ");
		}
		for (OptionSpec<Integer> os : IntegerParameters) {
			w.write("'" + format(os.toString()) + "': " + CacheSim.Options.valueOf(os) + ", ");
		}
	}

}
