package works.bosk.arbor.codec.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.arbor.codec.JsonTreeParser.Settings;
import works.bosk.arbor.codec.Production;
import works.bosk.arbor.codec.Token;
import works.bosk.arbor.exceptions.InvalidEscapeException;
import works.bosk.arbor.exceptions.JsonProcessingException;
import works.bosk.arbor.exceptions.MalformedNumberException;
import works.bosk.arbor.exceptions.NoMatchException;
import works.bosk.arbor.exceptions.UnterminatedStringException;
import works.bosk.arbor.value.Num;

import static java.util.Objects.requireNonNull;
import static works.bosk.arbor.codec.Token.FALSE;
import static works.bosk.arbor.codec.Token.NULL;
import static works.bosk.arbor.codec.Token.NUMBER;
import static works.bosk.arbor.codec.Token.TRUE;

/**
 * Recognizers for the leaf productions: keywords, numbers, and strings.
 * Subclasses add the structural productions on top.
 * <p>
 * Each recognizer expects {@link TextCursor#peekValueToken()} to have
 * already been called, so that the cursor sits on the first character of the production.
 * On success, the production has been consumed;
 * on failure, a {@link works.bosk.arbor.exceptions.JsonFormatException} is thrown
 * and the cursor position no longer matters.
 */
public abstract class ScalarParserRuntime {
	protected final TextCursor input;
	protected final Settings settings;

	protected ScalarParserRuntime(TextCursor input, Settings settings) {
		this.input = requireNonNull(input);
		this.settings = requireNonNull(settings);
	}

	protected final void parseNull() {
		logEntry("parseNull");
		if (!input.consumeIfPresent(NULL.literal())) {
			throw noMatch("Expected null", Production.NULL);
		}
	}

	protected final boolean parseBoolean() {
		logEntry("parseBoolean");
		Token token = input.peekRawToken();
		if (token == TRUE && input.consumeIfPresent(TRUE.literal())) {
			return true;
		} else if (token == FALSE && input.consumeIfPresent(FALSE.literal())) {
			return false;
		} else {
			throw noMatch("Expected true or false", Production.BOOLEAN);
		}
	}

	/**
	 * Grammar: {@code [sign] digits ['.' digits] [('e'|'E') [sign] digits]}.
	 * <p>
	 * A literal with neither a fraction nor an exponent is {@link Num.Integral};
	 * anything else is {@link Num.Floating}.
	 * The conversions are done by the JDK on the consumed text, which gives
	 * correctly rounded doubles and lets {@link Long#MIN_VALUE} through.
	 */
	protected final Num parseNumber() {
		logEntry("parseNumber");
		assert input.peekRawToken() == NUMBER;
		int start = input.position();
		if (Util.isSign(input.peekRawChar())) {
			input.advance();
		}
		if (input.consumeDigits() == 0) {
			throw new MalformedNumberException("Expected digits", input.currentOffset());
		}

		boolean hasFraction = false;
		if (input.consumeIf('.')) {
			if (input.consumeDigits() == 0) {
				throw new MalformedNumberException("Expected digits after decimal point", input.currentOffset());
			}
			hasFraction = true;
		}

		boolean hasExponent = false;
		if (Util.isExponentMarker(input.peekRawChar())) {
			if (!hasFraction && !settings.allowBareExponent()) {
				throw new MalformedNumberException("Exponent must follow a decimal fraction", input.currentOffset());
			}
			input.advance();
			if (Util.isSign(input.peekRawChar())) {
				input.advance();
			}
			if (input.consumeDigits() == 0) {
				throw new MalformedNumberException("Expected exponent digits", input.currentOffset());
			}
			hasExponent = true;
		}

		String literal = input.textSince(start);
		if (hasFraction || hasExponent) {
			double value = Double.parseDouble(literal);
			if (Double.isInfinite(value)) {
				throw new MalformedNumberException("Number out of range: " + literal, start);
			}
			return new Num.Floating(value);
		} else {
			try {
				return new Num.Integral(Long.parseLong(literal));
			} catch (NumberFormatException e) {
				throw new MalformedNumberException("Integer out of range: " + literal, start, e);
			}
		}
	}

	/**
	 * Depending on {@link Settings#decodeEscapes()}, either decodes backslash escapes
	 * or takes everything up to the next quote verbatim.
	 */
	protected final String parseString() {
		logEntry("parseString");
		int openingQuote = input.position();
		if (!input.consumeIf('"')) {
			throw noMatch("Expected string", Production.STRING);
		}
		int start = input.position();
		if (!settings.decodeEscapes()) {
			if (!input.skipTo('"')) {
				throw unterminated(openingQuote);
			}
			String result = input.textSince(start);
			input.advance();
			return result;
		}

		// Fast path: no escapes
		int c;
		while ((c = input.peekRawChar()) != '"') {
			if (c == -1) {
				throw unterminated(openingQuote);
			} else if (c == '\\') {
				StringBuilder sb = new StringBuilder();
				input.appendSince(start, sb);
				return decodeRemainder(openingQuote, sb);
			}
			input.advance();
		}
		String result = input.textSince(start);
		input.advance();
		return result;
	}

	private String decodeRemainder(int openingQuote, StringBuilder sb) {
		int c;
		while ((c = input.peekRawChar()) != '"') {
			if (c == -1) {
				throw unterminated(openingQuote);
			}
			input.advance();
			if (c == '\\') {
				sb.append(decodeEscape(openingQuote));
			} else {
				sb.append((char) c);
			}
		}
		input.advance();
		return sb.toString();
	}

	/**
	 * Cursor is just past the backslash.
	 * Surrogate pairs come through as two separate backslash-u escapes,
	 * and appending both to a StringBuilder reassembles them.
	 */
	private char decodeEscape(int openingQuote) {
		long backslashOffset = input.currentOffset() - 1;
		int esc = input.peekRawChar();
		if (esc == -1) {
			throw unterminated(openingQuote);
		}
		input.advance();
		return switch (esc) {
			case '"', '\\', '/' -> (char) esc;
			case 'b' -> '\b';
			case 'f' -> '\f';
			case 'n' -> '\n';
			case 'r' -> '\r';
			case 't' -> '\t';
			case 'u' -> {
				int value = 0;
				for (int i = 0; i < 4; i++) {
					int digit = Util.hexDigitValue(input.peekRawChar());
					if (digit < 0) {
						throw new InvalidEscapeException("Unicode escape needs four hex digits", backslashOffset);
					}
					input.advance();
					value = (value << 4) | digit;
				}
				yield (char) value;
			}
			default -> throw new InvalidEscapeException("Invalid escape: \\" + (char) esc, backslashOffset);
		};
	}

	/**
	 * Polled by structural recognizers between elements,
	 * so a parse of a huge document can be cancelled by interrupting its thread.
	 * Leaves the interrupt status set.
	 */
	protected final void checkInterrupted() {
		if (Thread.currentThread().isInterrupted()) {
			throw new JsonProcessingException("Parsing interrupted at offset " + input.currentOffset());
		}
	}

	protected final NoMatchException noMatch(String message, Production expected) {
		return new NoMatchException(message + ": |" + previewString() + "|", input.currentOffset(), expected);
	}

	private UnterminatedStringException unterminated(int openingQuote) {
		return new UnterminatedStringException(
			"No closing quote for string starting at offset " + openingQuote,
			input.currentOffset());
	}

	protected final String previewString() {
		return input.previewString(10)
			.replace('\n', ' ')
			.replace('\r', ' ');
	}

	protected final void logEntry(String methodName) {
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("{} @ {}: |{}|", methodName, input.currentOffset(), previewString());
		}
	}

	protected final void logEntry(String methodName, int depth) {
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("{}({}) @ {}: |{}|", methodName, depth, input.currentOffset(), previewString());
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ScalarParserRuntime.class);
}
