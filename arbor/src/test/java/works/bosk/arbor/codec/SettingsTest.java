package works.bosk.arbor.codec;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedClass;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import works.bosk.arbor.codec.JsonTreeParser.Settings;
import works.bosk.arbor.exceptions.DepthExceededException;
import works.bosk.arbor.exceptions.NoMatchException;
import works.bosk.arbor.exceptions.UnterminatedStringException;
import works.bosk.arbor.value.JsonArray;
import works.bosk.arbor.value.JsonNumber;
import works.bosk.arbor.value.JsonObject;
import works.bosk.arbor.value.JsonString;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@ParameterizedClass
@MethodSource("inputForms")
class SettingsTest extends AbstractParserTest {

	@Test
	void defaults() {
		Settings settings = Settings.DEFAULT;
		assertEquals(512, settings.maxDepth());
		assertEquals(true, settings.decodeEscapes());
		assertEquals(true, settings.allowBareExponent());
		assertEquals(false, settings.allowEmptyObjects());
		assertEquals(true, settings.requireEndOfText());
		assertSame(settings, JsonTreeParser.standard().settings());
	}

	@Test
	void withMethodsChangeOneField() {
		Settings settings = Settings.DEFAULT
			.withMaxDepth(3)
			.withDecodeEscapes(false)
			.withAllowBareExponent(false)
			.withAllowEmptyObjects(true)
			.withRequireEndOfText(false);
		assertEquals(new Settings(3, false, false, true, false), settings);
	}

	@Test
	void negativeMaxDepthIsRejected() {
		assertThrows(IllegalArgumentException.class, () -> Settings.DEFAULT.withMaxDepth(-1));
	}

	@Test
	void maxDepthIsCapped() {
		assertThrows(IllegalArgumentException.class, () -> Settings.DEFAULT.withMaxDepth(Settings.MAX_DEPTH_LIMIT + 1));
		assertThrows(IllegalArgumentException.class, () -> Settings.DEFAULT.withMaxDepth(Integer.MAX_VALUE));
	}

	@Test
	void nestingAtTheCap() {
		int limit = Settings.MAX_DEPTH_LIMIT;
		JsonTreeParser parser = JsonTreeParser.using(Settings.DEFAULT.withMaxDepth(limit));
		parse(parser, "[".repeat(limit) + "]".repeat(limit));

		String tooDeep = "[".repeat(limit + 1) + "]".repeat(limit + 1);
		var e = assertThrows(DepthExceededException.class, () -> parse(parser, tooDeep));
		assertEquals(limit, e.offset());
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"[[[1]]]",
		"{\"a\":{\"b\":{\"c\":1}}}",
		"[{\"a\":[1]}]",
	})
	void nestingUpToLimit(String json) {
		JsonTreeParser parser = JsonTreeParser.using(Settings.DEFAULT.withMaxDepth(3));
		parse(parser, json);
	}

	@Test
	void nestingBeyondLimit() {
		JsonTreeParser parser = JsonTreeParser.using(Settings.DEFAULT.withMaxDepth(2));
		var e = assertThrows(DepthExceededException.class, () -> parse(parser, "[{\"a\":[1]}]"));
		assertEquals(2, e.maxDepth());
		assertEquals(6, e.offset());
		assertEquals(Production.ARRAY, e.expected());

		e = assertThrows(DepthExceededException.class, () -> parse(parser, "[[{\"a\":1}]]"));
		assertEquals(2, e.offset());
		assertEquals(Production.OBJECT, e.expected());
	}

	@Test
	void zeroDepthAdmitsOnlyScalars() {
		JsonTreeParser parser = JsonTreeParser.using(Settings.DEFAULT.withMaxDepth(0));
		assertEquals(JsonNumber.of(1), parse(parser, "1"));
		assertEquals(new JsonString("x"), parse(parser, "\"x\""));
		var e = assertThrows(DepthExceededException.class, () -> parse(parser, "[]"));
		assertEquals(0, e.offset());
	}

	@Test
	void emptyObjects() {
		assertThrows(NoMatchException.class, () -> parse("{}"));

		JsonTreeParser lenient = JsonTreeParser.using(Settings.DEFAULT.withAllowEmptyObjects(true));
		assertEquals(new JsonObject(Map.of()), parse(lenient, "{}"));
		assertEquals(new JsonObject(Map.of()), parse(lenient, "{ \n }"));
		assertEquals(
			new JsonObject(Map.of("a", new JsonObject(Map.of()))),
			parse(lenient, "{\"a\": {}}"));
		assertThrows(NoMatchException.class, () -> parse(lenient, "{\"a\": 1,}"),
			"Trailing commas are still rejected");
	}

	@Test
	void verbatimStrings() {
		JsonTreeParser verbatim = JsonTreeParser.using(Settings.VERBATIM);
		assertEquals(new JsonString("a\\nb"), parse(verbatim, "\"a\\nb\""));
		assertEquals(new JsonString("C:\\temp\\"), parse(verbatim, "\"C:\\temp\\\""),
			"A backslash before the closing quote does not escape it");
		assertEquals(
			new JsonObject(Map.of("\\u0041", JsonNumber.of(1))),
			parse(verbatim, "{\"\\u0041\": 1}"));
		assertThrows(UnterminatedStringException.class, () -> parse(verbatim, "\"abc"));
	}

	@Test
	void trailingText() {
		assertThrows(NoMatchException.class, () -> parse("[1] [2]"));

		JsonTreeParser lenient = JsonTreeParser.using(Settings.DEFAULT.withRequireEndOfText(false));
		assertEquals(JsonArray.of(JsonNumber.of(1)), parse(lenient, "[1] [2]"));
		assertEquals(JsonNumber.of(12), parse(lenient, "12abc"));
		assertEquals(new JsonString("a"), parse(lenient, "\"a\"\"b\""));
	}
}
