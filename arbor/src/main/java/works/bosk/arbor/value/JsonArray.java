package works.bosk.arbor.value;

import java.util.List;

/**
 * Elements are kept in source order. The list is unmodifiable.
 */
public record JsonArray(List<JsonValue> elements) implements JsonValue {
	public static final JsonArray EMPTY = new JsonArray(List.of());

	public JsonArray {
		elements = List.copyOf(elements);
	}

	public static JsonArray of(JsonValue... elements) {
		return new JsonArray(List.of(elements));
	}

	public JsonValue get(int index) {
		return elements.get(index);
	}

	public int size() {
		return elements.size();
	}

	@Override
	public Type type() {
		return Type.ARRAY;
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitArray(elements);
	}
}
