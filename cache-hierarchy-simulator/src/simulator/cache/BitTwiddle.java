package simulator.cache;

public class BitTwiddle {
	public static boolean isPowerOf2(long n) {
		// thank you, Hacker's Delight!
		return n > 0 && 0 == (n & (n - 1));
	}

	/** Lower-case hex rendering of an address, as used in logs and line dumps. */
	public static String hex(long n) {
		return "0x" + Long.toUnsignedString(n, 16);
	}
}
