package simulator.cache;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.StringTokenizer;

/**
 * Reads a trace of memory accesses, one {@code <op> <address>} pair per line.
 * The operation is R or W; the address is decimal, or hexadecimal with a 0x
 * prefix. The whole trace is read before simulation starts, so a bad line
 * aborts the run before any output.
 */
public final class TraceReader {

	private TraceReader() {
	}

	public static List<AccessRecord> read(File f) throws IOException {
		try (Reader r = Files.newBufferedReader(f.toPath(), StandardCharsets.UTF_8)) {
			return read(r);
		}
	}

	public static List<AccessRecord> read(Reader r) throws IOException {
		BufferedReader in = new BufferedReader(r);
		List<AccessRecord> trace = new ArrayList<AccessRecord>();
		String line;
		int lineNumber = 0;
		while ((line = in.readLine()) != null) {
			lineNumber++;
			String trimmed = line.trim();
			if (trimmed.isEmpty() || trimmed.startsWith("#")) {
				continue;
			}
			trace.add(parseLine(trimmed, lineNumber));
		}
		return trace;
	}

	static AccessRecord parseLine(String line, int lineNumber) {
		StringTokenizer tok = new StringTokenizer(line);
		if (tok.countTokens() != 2) {
			throw new TraceException(lineNumber, "expected '<op> <address>' but found '" + line + "'");
		}
		String s = tok.nextToken();
		Operation op = Operation.fromToken(s);
		if (op == null) {
			throw new TraceException(lineNumber, "unknown operation '" + s + "'");
		}
		return new AccessRecord(op, parseAddress(tok.nextToken(), lineNumber));
	}

	static long parseAddress(String s, int lineNumber) {
		String digits = s;
		int radix = 10;
		if (s.startsWith("0x") || s.startsWith("0X")) {
			digits = s.substring(2);
			radix = 16;
		}
		// addresses are unsigned; parseUnsignedLong would accept a plus sign
		if (digits.isEmpty() || digits.charAt(0) == '-' || digits.charAt(0) == '+') {
			throw new TraceException(lineNumber, "bad address '" + s + "'");
		}
		try {
			return Long.parseUnsignedLong(digits, radix);
		} catch (NumberFormatException nfe) {
			throw new TraceException(lineNumber, "bad address '" + s + "'");
		}
	}
}
