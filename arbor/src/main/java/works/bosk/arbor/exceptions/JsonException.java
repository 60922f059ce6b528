package works.bosk.arbor.exceptions;

public sealed abstract class JsonException extends RuntimeException permits JsonFormatException, JsonProcessingException {
	protected JsonException(String message) {
		super(message);
	}

	protected JsonException(String message, Throwable cause) {
		super(message, cause);
	}
}
