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
 * Reads a cache configuration file. Each non-blank line describes one level,
 * L1 first:
 *
 * <pre>
 * &lt;size&gt; &lt;block size&gt; &lt;associativity&gt; &lt;FIFO|LRU|MRU&gt; &lt;WB&gt; &lt;L1|L2&gt;
 * </pre>
 *
 * Lines starting with {@code #} are comments.
 */
public final class ConfigParser {

	static final int FIELDS = 6;
	static final int MAX_LEVELS = 2;

	private ConfigParser() {
	}

	public static List<CacheConfig> parse(File f) throws IOException {
		try (Reader r = Files.newBufferedReader(f.toPath(), StandardCharsets.UTF_8)) {
			return parse(r);
		}
	}

	public static List<CacheConfig> parse(Reader r) throws IOException {
		BufferedReader in = new BufferedReader(r);
		List<CacheConfig> configs = new ArrayList<CacheConfig>(MAX_LEVELS);
		String line;
		int lineNumber = 0;
		while ((line = in.readLine()) != null) {
			lineNumber++;
			String trimmed = line.trim();
			if (trimmed.isEmpty() || trimmed.startsWith("#")) {
				continue;
			}
			if (configs.size() == MAX_LEVELS) {
				throw new ConfigException(lineNumber, "at most " + MAX_LEVELS + " cache levels are supported");
			}
			CacheConfig c = parseLine(trimmed, lineNumber);
			Level expected = configs.isEmpty() ? Level.L1 : Level.L2;
			if (c.level != expected) {
				throw new ConfigException(lineNumber, "expected level " + expected + " but found " + c.level);
			}
			configs.add(c);
		}
		if (configs.isEmpty()) {
			throw new ConfigException("no cache levels configured");
		}
		return configs;
	}

	static CacheConfig parseLine(String line, int lineNumber) {
		StringTokenizer tok = new StringTokenizer(line);
		if (tok.countTokens() != FIELDS) {
			throw new ConfigException(lineNumber,
					"expected " + FIELDS + " fields (size block-size associativity policy write-policy level), found "
							+ tok.countTokens());
		}
		int size = parseInt(tok.nextToken(), "cache size", lineNumber);
		int blockSize = parseInt(tok.nextToken(), "block size", lineNumber);
		int assoc = parseInt(tok.nextToken(), "associativity", lineNumber);

		String s = tok.nextToken();
		ReplacementPolicy policy = ReplacementPolicy.fromToken(s);
		if (policy == null) {
			throw new ConfigException(lineNumber, "unsupported eviction policy '" + s + "'");
		}
		s = tok.nextToken();
		WritePolicy writePolicy = WritePolicy.fromToken(s);
		if (writePolicy == null) {
			throw new ConfigException(lineNumber, "unsupported write policy '" + s + "'");
		}
		s = tok.nextToken();
		Level level = Level.fromToken(s);
		if (level == null) {
			throw new ConfigException(lineNumber, "unknown cache level '" + s + "'");
		}

		try {
			return new CacheConfig(size, blockSize, assoc, policy, writePolicy, level);
		} catch (ConfigException ce) {
			throw new ConfigException(lineNumber, ce.getMessage());
		}
	}

	private static int parseInt(String s, String what, int lineNumber) {
		try {
			return Integer.parseInt(s);
		} catch (NumberFormatException nfe) {
			throw new ConfigException(lineNumber, what + " '" + s + "' is not a number");
		}
	}
}
