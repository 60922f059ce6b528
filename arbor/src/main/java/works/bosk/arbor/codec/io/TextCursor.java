package works.bosk.arbor.codec.io;

import works.bosk.arbor.codec.Token;

import static java.lang.Math.max;
import static java.lang.Math.min;

/**
 * A read position within a complete JSON text held in a char array.
 * <p>
 * Recognizers look ahead with the {@code peek} methods and move forward
 * with the {@code consume}/{@code skip} methods. Nothing here ever moves backward,
 * and nothing here throws for running off the end: the end of input
 * reads as -1, and deciding what that means is up to the caller.
 */
public final class TextCursor {
	private final char[] chars;
	private int pos = 0;

	public TextCursor(char[] chars) {
		this.chars = chars;
	}

	public static TextCursor forText(CharSequence text) {
		return new TextCursor(text.toString().toCharArray());
	}

	/**
	 * @return the next char, or -1 at end of input. NOT a code point!
	 */
	public int peekRawChar() {
		if (pos >= chars.length) {
			return -1;
		} else {
			return chars[pos];
		}
	}

	public Token peekRawToken() {
		return Token.startingWith(peekRawChar());
	}

	/**
	 * Skips whitespace and returns the token that starts at the next significant character.
	 * Idempotent: calling it repeatedly returns the same result.
	 */
	public Token peekValueToken() {
		skipWhitespace();
		return peekRawToken();
	}

	public void skipWhitespace() {
		while (Util.fast_isWhitespace(peekRawChar())) {
			pos++;
		}
	}

	/**
	 * Caller must know there is a next character.
	 */
	public void advance() {
		assert pos < chars.length;
		pos++;
	}

	/**
	 * @return true if the next char is {@code c}, in which case it has been consumed
	 */
	public boolean consumeIf(char c) {
		if (pos < chars.length && chars[pos] == c) {
			pos++;
			return true;
		} else {
			return false;
		}
	}

	/**
	 * Consumes {@code expectedCharacters} if the input continues with exactly those characters.
	 * Otherwise, consumes nothing.
	 *
	 * @return whether the characters were consumed
	 */
	public boolean consumeIfPresent(CharSequence expectedCharacters) {
		if (expectedCharacters.length() > chars.length - pos) {
			return false;
		}
		for (int i = 0; i < expectedCharacters.length(); i++) {
			if (chars[pos + i] != expectedCharacters.charAt(i)) {
				return false;
			}
		}
		pos += expectedCharacters.length();
		return true;
	}

	/**
	 * @return the number of decimal digits consumed, possibly zero
	 */
	public int consumeDigits() {
		int start = pos;
		while (pos < chars.length && Util.isDigit(chars[pos])) {
			pos++;
		}
		return pos - start;
	}

	/**
	 * Moves to the next occurrence of {@code c}, without consuming it.
	 *
	 * @return false if there is no such occurrence, in which case the position is unchanged
	 */
	public boolean skipTo(char c) {
		for (int i = pos; i < chars.length; i++) {
			if (chars[i] == c) {
				pos = i;
				return true;
			}
		}
		return false;
	}

	/**
	 * @return a new String holding the characters from {@code start} up to the current position
	 */
	public String textSince(int start) {
		return new String(chars, start, pos - start);
	}

	public void appendSince(int start, StringBuilder sb) {
		sb.append(chars, start, pos - start);
	}

	public int position() {
		return pos;
	}

	/**
	 * On a best-effort basis, return the upcoming characters in the input.
	 */
	public String previewString(int requestedLength) {
		int actualLength = max(0, min(requestedLength, chars.length - pos));
		return new String(chars, pos, actualLength);
	}

	/**
	 * @return the offset of the next unconsumed character. Useful for diagnostics.
	 */
	public long currentOffset() {
		return pos;
	}
}
