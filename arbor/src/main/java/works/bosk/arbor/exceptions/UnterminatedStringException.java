package works.bosk.arbor.exceptions;

import works.bosk.arbor.codec.Production;

/**
 * The input ended before the closing quote of a string.
 */
public final class UnterminatedStringException extends JsonFormatException {
	public UnterminatedStringException(String message, long offset) {
		super(message, offset, Production.STRING);
	}
}
