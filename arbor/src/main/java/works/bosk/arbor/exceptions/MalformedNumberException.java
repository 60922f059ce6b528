package works.bosk.arbor.exceptions;

import works.bosk.arbor.codec.Production;

/**
 * A numeric literal started but did not follow the number grammar,
 * or its value cannot be represented.
 */
public final class MalformedNumberException extends JsonFormatException {
	public MalformedNumberException(String message, long offset) {
		super(message, offset, Production.NUMBER);
	}

	public MalformedNumberException(String message, long offset, Throwable cause) {
		super(message, offset, Production.NUMBER, cause);
	}
}
