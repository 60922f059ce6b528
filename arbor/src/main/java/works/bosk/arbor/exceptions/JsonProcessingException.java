package works.bosk.arbor.exceptions;

/**
 * Parsing stopped for a reason that has nothing to do with the input text.
 * <p>
 * Currently this means the parsing thread was interrupted.
 * The thread's interrupt status is left set, so callers that
 * care about interruption can still see it.
 */
public final class JsonProcessingException extends JsonException {
	public JsonProcessingException(String message) {
		super(message);
	}
}
