package works.bosk.arbor.value;

public record JsonNull() implements JsonValue {
	public static final JsonNull INSTANCE = new JsonNull();

	@Override
	public Type type() {
		return Type.NULL;
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitNull();
	}

	@Override
	public String toString() {
		return "JsonNull";
	}
}
