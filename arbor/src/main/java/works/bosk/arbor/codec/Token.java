package works.bosk.arbor.codec;

import java.util.Arrays;

/**
 * What the parser can find at the current position, judged by one character of lookahead.
 * <p>
 * Every value production starts with a distinct character,
 * so the token alone is enough to choose a recognizer.
 */
public enum Token {
	END_TEXT(""),
	NULL("null"),
	FALSE("false"),
	TRUE("true"),
	NUMBER(null),
	STRING(null),
	START_OBJECT("{"),
	END_OBJECT("}"),
	START_ARRAY("["),
	END_ARRAY("]"),
	COMMA(","),
	COLON(":"),
	WHITESPACE(null),
	ERROR(null);

	/**
	 * Null for tokens whose text varies.
	 */
	private final String literal;

	Token(String literal) {
		this.literal = literal;
	}

	private static final Token[] ASCII_LEADS = new Token[128];

	static {
		Arrays.fill(ASCII_LEADS, ERROR);
		for (Token token : values()) {
			if (token.literal != null && !token.literal.isEmpty()) {
				ASCII_LEADS[token.literal.charAt(0)] = token;
			}
		}
		for (char c = '0'; c <= '9'; c++) {
			ASCII_LEADS[c] = NUMBER;
		}
		ASCII_LEADS['-'] = NUMBER;
		ASCII_LEADS['+'] = NUMBER;
		ASCII_LEADS['"'] = STRING;
		for (char c : new char[]{' ', '\t', '\n', '\r'}) {
			ASCII_LEADS[c] = WHITESPACE;
		}
	}

	/**
	 * @param c a character, or -1 for the end of the input.
	 *          Need not be a code point: lone surrogates are simply {@link #ERROR}.
	 */
	public static Token startingWith(int c) {
		if (c == -1) {
			return END_TEXT;
		} else if (c >= 0 && c < ASCII_LEADS.length) {
			return ASCII_LEADS[c];
		} else {
			return ERROR;
		}
	}

	/**
	 * @return true for the one-character structural tokens: brackets, braces, comma and colon
	 */
	public boolean isPunctuation() {
		return literal != null && literal.length() == 1;
	}

	/**
	 * @return the exact text of this token
	 * @throws IllegalStateException if the token's text varies, as for numbers and strings
	 */
	public String literal() {
		if (literal == null) {
			throw new IllegalStateException("Token has no fixed text: " + this);
		}
		return literal;
	}
}
