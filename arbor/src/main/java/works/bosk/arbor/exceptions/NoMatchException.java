package works.bosk.arbor.exceptions;

import works.bosk.arbor.codec.Production;

/**
 * No production applies at the current position.
 * Covers empty input, unknown characters, truncated keywords,
 * missing delimiters, trailing commas, and (by default) empty objects.
 */
public final class NoMatchException extends JsonFormatException {
	public NoMatchException(String message, long offset, Production expected) {
		super(message, offset, expected);
	}
}
