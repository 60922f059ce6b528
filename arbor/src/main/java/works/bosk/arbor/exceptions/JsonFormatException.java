package works.bosk.arbor.exceptions;

import works.bosk.arbor.codec.Production;

import static java.util.Objects.requireNonNull;

/**
 * The input text is not acceptable to the parser.
 * <p>
 * Every subclass records where the problem was detected
 * and which {@link Production} the parser was trying to recognize there.
 * Parsing stops at the first problem, so there is never more than one
 * of these per parse, and never a partial result.
 */
public sealed abstract class JsonFormatException extends JsonException permits
	DepthExceededException,
	InvalidEscapeException,
	MalformedNumberException,
	NoMatchException,
	UnterminatedStringException
{
	private final long offset;
	private final Production expected;

	protected JsonFormatException(String message, long offset, Production expected) {
		super(describe(message, offset, expected));
		this.offset = offset;
		this.expected = requireNonNull(expected);
	}

	protected JsonFormatException(String message, long offset, Production expected, Throwable cause) {
		super(describe(message, offset, expected), cause);
		this.offset = offset;
		this.expected = requireNonNull(expected);
	}

	/**
	 * @return the character offset in the input at which the problem was detected
	 */
	public long offset() {
		return offset;
	}

	public Production expected() {
		return expected;
	}

	private static String describe(String message, long offset, Production expected) {
		return message + " (expecting " + expected + " at offset " + offset + ")";
	}
}
