package works.bosk.arbor.value;

import static java.util.Objects.requireNonNull;

/**
 * A JSON number, which is either {@link Num.Integral integral} or {@link Num.Floating floating-point}
 * depending on how it was written: a literal with a decimal point or an exponent
 * is floating-point even if its value happens to be a whole number.
 */
public record JsonNumber(Num value) implements JsonValue {
	public JsonNumber {
		requireNonNull(value);
	}

	public static JsonNumber of(long value) {
		return new JsonNumber(new Num.Integral(value));
	}

	public static JsonNumber of(double value) {
		return new JsonNumber(new Num.Floating(value));
	}

	@Override
	public Type type() {
		return Type.NUMBER;
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitNumber(value);
	}
}
