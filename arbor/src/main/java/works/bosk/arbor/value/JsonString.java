package works.bosk.arbor.value;

import static java.util.Objects.requireNonNull;

public record JsonString(String value) implements JsonValue {
	public JsonString {
		requireNonNull(value);
	}

	@Override
	public Type type() {
		return Type.STRING;
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitString(value);
	}
}
