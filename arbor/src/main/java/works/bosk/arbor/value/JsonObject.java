package works.bosk.arbor.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Member names are unique.
 * Iteration follows the order in which each name first appeared,
 * but that order plays no part in {@link #equals}.
 */
public record JsonObject(Map<String, JsonValue> members) implements JsonValue {
	public JsonObject {
		LinkedHashMap<String, JsonValue> copy = new LinkedHashMap<>();
		members.forEach((name, value) -> copy.put(requireNonNull(name), requireNonNull(value)));
		members = Collections.unmodifiableMap(copy);
	}

	public Optional<JsonValue> get(String name) {
		return Optional.ofNullable(members.get(name));
	}

	public int size() {
		return members.size();
	}

	@Override
	public Type type() {
		return Type.OBJECT;
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitObject(members);
	}
}
