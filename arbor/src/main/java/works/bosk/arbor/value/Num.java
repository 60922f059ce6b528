package works.bosk.arbor.value;

/**
 * The payload of a {@link JsonNumber}.
 * <p>
 * The two cases never convert into each other implicitly:
 * an {@link Integral} is not equal to a {@link Floating} with the same magnitude.
 * Use {@link #accept} to handle both, or {@link #doubleValue()} to widen on purpose.
 */
public sealed interface Num permits Num.Integral, Num.Floating {
	/**
	 * @return this number as a double, which may lose precision for large {@link Integral} values
	 */
	double doubleValue();

	<R> R accept(Visitor<R> visitor);

	record Integral(long value) implements Num {
		@Override
		public double doubleValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitIntegral(value);
		}
	}

	/**
	 * Equality follows {@link Double#compare}, so {@code -0.0} and {@code 0.0} differ.
	 */
	record Floating(double value) implements Num {
		@Override
		public double doubleValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitFloating(value);
		}
	}

	interface Visitor<R> {
		R visitIntegral(long value);
		R visitFloating(double value);
	}
}
