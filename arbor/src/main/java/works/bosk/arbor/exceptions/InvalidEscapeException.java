package works.bosk.arbor.exceptions;

import works.bosk.arbor.codec.Production;

/**
 * A backslash inside a string was followed by something other than
 * a recognized escape sequence.
 */
public final class InvalidEscapeException extends JsonFormatException {
	public InvalidEscapeException(String message, long offset) {
		super(message, offset, Production.STRING);
	}
}
