package works.bosk.arbor.codec;

import java.util.stream.Stream;
import org.junit.jupiter.params.Parameter;
import works.bosk.arbor.value.JsonValue;

/**
 * Runs each test against every way of handing text to a {@link Parser}.
 * Subclasses are annotated with {@code @ParameterizedClass} and {@code @MethodSource("inputForms")}.
 */
public class AbstractParserTest {
	@Parameter
	InputForm inputForm;

	protected JsonValue parse(String json) {
		return parse(JsonTreeParser.standard(), json);
	}

	protected JsonValue parse(Parser parser, String json) {
		return inputForm.parse(parser, json);
	}

	@SuppressWarnings("unused") // Subclasses use this to parameterize tests
	static Stream<InputForm> inputForms() {
		return Stream.of(
			new AsString(),
			new AsCharArray(),
			new AsStringBuilder()
		);
	}

	interface InputForm {
		JsonValue parse(Parser parser, String json);
	}

	static final class AsString implements InputForm {
		@Override
		public JsonValue parse(Parser parser, String json) {
			return parser.parse(json);
		}

		@Override
		public String toString() {
			return "String";
		}
	}

	static final class AsCharArray implements InputForm {
		@Override
		public JsonValue parse(Parser parser, String json) {
			return parser.parse(json.toCharArray());
		}

		@Override
		public String toString() {
			return "Char array";
		}
	}

	static final class AsStringBuilder implements InputForm {
		@Override
		public JsonValue parse(Parser parser, String json) {
			return parser.parse(new StringBuilder(json));
		}

		@Override
		public String toString() {
			return "StringBuilder";
		}
	}
}
