package works.bosk.arbor.value;

import java.util.List;
import java.util.Map;

/**
 * An immutable JSON value: the node type of a parsed value tree.
 * <p>
 * The set of implementations is closed. To handle every kind of value,
 * either switch on {@link #type()} or implement a {@link Visitor};
 * the visitor is the one to use when the compiler should flag a missing case.
 * <p>
 * Trees are built bottom-up, so they are always finite and acyclic,
 * and they never refer back to the text they were parsed from.
 */
public sealed interface JsonValue permits
	JsonNull,
	JsonBoolean,
	JsonNumber,
	JsonString,
	JsonArray,
	JsonObject
{
	Type type();

	<R> R accept(Visitor<R> visitor);

	enum Type {
		NULL,
		BOOLEAN,
		NUMBER,
		STRING,
		ARRAY,
		OBJECT,
	}

	/**
	 * Exhaustive dispatch over the six kinds of {@link JsonValue}.
	 * Each method receives the payload rather than the wrapper,
	 * since that's what callers almost always want.
	 */
	interface Visitor<R> {
		R visitNull();
		R visitBoolean(boolean value);
		R visitNumber(Num value);
		R visitString(String value);
		R visitArray(List<JsonValue> elements);
		R visitObject(Map<String, JsonValue> members);
	}
}
