package works.bosk.arbor.codec;

import works.bosk.arbor.exceptions.JsonFormatException;
import works.bosk.arbor.exceptions.JsonProcessingException;
import works.bosk.arbor.value.JsonValue;

/**
 * Creates a {@link JsonValue} tree from a complete JSON text held in memory.
 * <p>
 * Implementations are stateless between calls, so one instance
 * can serve any number of threads at once.
 */
public interface Parser {
	/**
	 * @throws JsonFormatException if the text is not acceptable; no partial tree is ever returned
	 * @throws JsonProcessingException if the calling thread is interrupted during the parse
	 */
	JsonValue parse(CharSequence text);

	/**
	 * Like {@link #parse(CharSequence)}, reading directly from the array.
	 * The array must not be modified while the parse is running.
	 * The resulting tree does not refer to it afterward.
	 */
	JsonValue parse(char[] chars);
}
