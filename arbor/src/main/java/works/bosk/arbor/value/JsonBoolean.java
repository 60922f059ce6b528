package works.bosk.arbor.value;

public record JsonBoolean(boolean value) implements JsonValue {
	public static final JsonBoolean TRUE = new JsonBoolean(true);
	public static final JsonBoolean FALSE = new JsonBoolean(false);

	public static JsonBoolean of(boolean value) {
		return value ? TRUE : FALSE;
	}

	@Override
	public Type type() {
		return Type.BOOLEAN;
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitBoolean(value);
	}
}
