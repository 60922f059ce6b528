package works.bosk.arbor.codec.io;

import java.util.stream.LongStream;
import works.bosk.arbor.codec.Token;

public class Util {
	private static final long WHITESPACE_CHARS = LongStream
		.of(0x20, 0x0A, 0x0D, 0x09)
		.map(n -> 1L << n)
		.sum();

	/**
	 * The parameter need not be an actual code point: it can also be a surrogate character,
	 * or -1 for end of input. All whitespace characters are ASCII.
	 */
	public static boolean fast_isWhitespace(int c) {
		// The position to check in WHITESPACE_CHARS
		long bit = 1L << c;

		// Zero if definitely not whitespace
		// Can have false positives
		long bitIsSet = WHITESPACE_CHARS & bit;

		// All ones if c is negative or greater than the largest whitespace char
		long isNegative = (long)c >> 63;
		long isTooBig = (63L - c) >> 63;

		long answer = bitIsSet & ~(isNegative | isTooBig);

		boolean result = (answer != 0);
		assert result == (Token.startingWith(c) == Token.WHITESPACE);
		return result;
	}

	public static boolean isDigit(int c) {
		return c >= '0' && c <= '9';
	}

	public static boolean isSign(int c) {
		return c == '-' || c == '+';
	}

	public static boolean isExponentMarker(int c) {
		return c == 'e' || c == 'E';
	}

	/**
	 * ASCII only, unlike {@link Character#digit(int, int)}.
	 *
	 * @return the value of the hex digit, or -1 if {@code c} is not one
	 */
	public static int hexDigitValue(int c) {
		if (c >= '0' && c <= '9') {
			return c - '0';
		} else if (c >= 'a' && c <= 'f') {
			return c - 'a' + 10;
		} else if (c >= 'A' && c <= 'F') {
			return c - 'A' + 10;
		} else {
			return -1;
		}
	}
}
