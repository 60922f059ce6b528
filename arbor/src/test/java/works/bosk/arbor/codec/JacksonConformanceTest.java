package works.bosk.arbor.codec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import works.bosk.arbor.value.JsonArray;
import works.bosk.arbor.value.JsonBoolean;
import works.bosk.arbor.value.JsonNull;
import works.bosk.arbor.value.JsonNumber;
import works.bosk.arbor.value.JsonObject;
import works.bosk.arbor.value.JsonString;
import works.bosk.arbor.value.JsonValue;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * For strictly valid JSON (no empty objects, no duplicate members, all numbers in range),
 * our tree should match the one Jackson builds.
 */
class JacksonConformanceTest {
	private static final ObjectMapper MAPPER = new ObjectMapper();

	@ParameterizedTest
	@ValueSource(strings = {
		"null",
		"true",
		"-42",
		"9223372036854775807",
		"3.14159",
		"-2.5E-3",
		"6.02214076e23",
		"\"plain\"",
		"\"esc\\\"aped\\\\ \\/ \\b\\f\\n\\r\\t \\u00e9 \\uD83D\\uDE0E\"",
		"[]",
		"[[[]]]",
		"[1, -1, 1.5, \"x\", true, false, null]",
		"{\"a\": 1, \"b\": [1, 2, 3]}",
		"{\"nested\": {\"deeper\": {\"deepest\": [{\"k\": \"v\"}]}}}",
		JsonTreeParserTest.SAMPLE,
	})
	void matchesJackson(String json) {
		JsonValue expected = fromJackson(MAPPER.readTree(json));
		JsonValue actual = JsonTreeParser.standard().parse(json);
		LOGGER.debug("Parsed {}", actual);
		assertEquals(expected, actual);
	}

	static JsonValue fromJackson(JsonNode node) {
		return switch (node.getNodeType()) {
			case NULL -> JsonNull.INSTANCE;
			case BOOLEAN -> JsonBoolean.of(node.booleanValue());
			case NUMBER -> node.isIntegralNumber()
				? JsonNumber.of(node.longValue())
				: JsonNumber.of(node.doubleValue());
			case STRING -> new JsonString(node.asString());
			case ARRAY -> {
				List<JsonValue> elements = new ArrayList<>();
				for (int i = 0; i < node.size(); i++) {
					elements.add(fromJackson(node.get(i)));
				}
				yield new JsonArray(elements);
			}
			case OBJECT -> {
				Map<String, JsonValue> members = new LinkedHashMap<>();
				for (Map.Entry<String, JsonNode> entry : node.properties()) {
					members.put(entry.getKey(), fromJackson(entry.getValue()));
				}
				yield new JsonObject(members);
			}
			default -> throw new AssertionError("Unexpected node type " + node.getNodeType());
		};
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JacksonConformanceTest.class);
}
