package works.bosk.arbor.codec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.arbor.codec.io.ScalarParserRuntime;
import works.bosk.arbor.codec.io.TextCursor;
import works.bosk.arbor.exceptions.DepthExceededException;
import works.bosk.arbor.exceptions.JsonFormatException;
import works.bosk.arbor.exceptions.JsonProcessingException;
import works.bosk.arbor.value.JsonArray;
import works.bosk.arbor.value.JsonBoolean;
import works.bosk.arbor.value.JsonNull;
import works.bosk.arbor.value.JsonNumber;
import works.bosk.arbor.value.JsonObject;
import works.bosk.arbor.value.JsonString;
import works.bosk.arbor.value.JsonValue;

import static java.util.Objects.requireNonNull;
import static works.bosk.arbor.codec.Token.COLON;
import static works.bosk.arbor.codec.Token.COMMA;
import static works.bosk.arbor.codec.Token.END_ARRAY;
import static works.bosk.arbor.codec.Token.END_OBJECT;
import static works.bosk.arbor.codec.Token.END_TEXT;
import static works.bosk.arbor.codec.Token.START_ARRAY;
import static works.bosk.arbor.codec.Token.START_OBJECT;
import static works.bosk.arbor.codec.Token.STRING;

/**
 * Recursive-descent parser from JSON text to a {@link JsonValue} tree.
 * <p>
 * The grammar accepted is:
 *
 * <pre>
 * value   := null | bool | number | string | array | object
 * number  := ["+"|"-"] digit+ ["." digit+] [("e"|"E") ["+"|"-"] digit+]
 * array   := "[" ws (value ws ("," ws value ws)*)? "]"
 * object  := "{" ws pair ws ("," ws pair ws)* "}"
 * pair    := string ws ":" ws value
 * ws      := (" " | "\t" | "\n" | "\r")*
 * </pre>
 *
 * with the details adjustable via {@link Settings}.
 * Instances are immutable; each call to {@link #parse} runs its own session.
 */
public final class JsonTreeParser implements Parser {
	private static final JsonTreeParser STANDARD = new JsonTreeParser(Settings.DEFAULT);

	private final Settings settings;

	private JsonTreeParser(Settings settings) {
		this.settings = requireNonNull(settings);
	}

	/**
	 * @return a parser using {@link Settings#DEFAULT}
	 */
	public static JsonTreeParser standard() {
		return STANDARD;
	}

	public static JsonTreeParser using(Settings settings) {
		return new JsonTreeParser(settings);
	}

	public Settings settings() {
		return settings;
	}

	@Override
	public JsonValue parse(CharSequence text) {
		return parse(TextCursor.forText(text));
	}

	@Override
	public JsonValue parse(char[] chars) {
		return parse(new TextCursor(chars));
	}

	private JsonValue parse(TextCursor cursor) {
		try {
			return new TreeParseSession(cursor, settings).parseDocument();
		} catch (JsonFormatException e) {
			LOGGER.debug("Parse failed at offset {} expecting {}", e.offset(), e.expected(), e);
			throw e;
		} catch (JsonProcessingException e) {
			LOGGER.debug("Parse abandoned: {}", e.getMessage(), e);
			throw e;
		}
	}

	/**
	 * @param maxDepth deepest permitted nesting of arrays and objects.
	 *                 Zero permits only scalar documents.
	 *                 Nesting is parsed recursively, so this may not exceed {@link #MAX_DEPTH_LIMIT},
	 *                 which stays well within a default thread stack.
	 * @param decodeEscapes if false, a string's contents are everything up to the next quote, verbatim,
	 *                      so a string cannot contain a quote.
	 * @param allowBareExponent if false, an exponent is allowed only after a decimal fraction, as in {@code 1.0e3};
	 *                          if true, {@code 1e3} is also accepted as a floating-point number.
	 * @param allowEmptyObjects if false, {@code {}} is rejected.
	 * @param requireEndOfText if false, anything following the first complete value is ignored.
	 */
	public record Settings(
		int maxDepth,
		boolean decodeEscapes,
		boolean allowBareExponent,
		boolean allowEmptyObjects,
		boolean requireEndOfText
	) {
		public static final int MAX_DEPTH_LIMIT = 1024;

		public static final Settings DEFAULT = new Settings(512, true, true, false, true);

		/**
		 * Strings are taken literally, with no escape processing,
		 * and text after the value is ignored.
		 */
		public static final Settings VERBATIM = new Settings(512, false, true, false, false);

		public Settings {
			if (maxDepth < 0 || maxDepth > MAX_DEPTH_LIMIT) {
				throw new IllegalArgumentException("maxDepth must be between 0 and " + MAX_DEPTH_LIMIT + ", got " + maxDepth);
			}
		}

		public Settings withMaxDepth(int maxDepth) {
			return new Settings(maxDepth, decodeEscapes, allowBareExponent, allowEmptyObjects, requireEndOfText);
		}

		public Settings withDecodeEscapes(boolean decodeEscapes) {
			return new Settings(maxDepth, decodeEscapes, allowBareExponent, allowEmptyObjects, requireEndOfText);
		}

		public Settings withAllowBareExponent(boolean allowBareExponent) {
			return new Settings(maxDepth, decodeEscapes, allowBareExponent, allowEmptyObjects, requireEndOfText);
		}

		public Settings withAllowEmptyObjects(boolean allowEmptyObjects) {
			return new Settings(maxDepth, decodeEscapes, allowBareExponent, allowEmptyObjects, requireEndOfText);
		}

		public Settings withRequireEndOfText(boolean requireEndOfText) {
			return new Settings(maxDepth, decodeEscapes, allowBareExponent, allowEmptyObjects, requireEndOfText);
		}
	}

	/**
	 * A single parsing operation, consuming text from a given {@link TextCursor}.
	 * <p>
	 * The {@code depth} parameter threaded through the recursion is the number of
	 * arrays and objects enclosing the value being parsed.
	 */
	private static final class TreeParseSession extends ScalarParserRuntime {
		private TreeParseSession(TextCursor input, Settings settings) {
			super(input, settings);
		}

		JsonValue parseDocument() {
			JsonValue result = parseValue(0);
			if (settings.requireEndOfText() && input.peekValueToken() != END_TEXT) {
				throw noMatch("Unexpected text after value", Production.END_OF_TEXT);
			}
			return result;
		}

		/**
		 * The value dispatcher. Each production has a distinct first character,
		 * so the lookahead token picks exactly one recognizer.
		 */
		private JsonValue parseValue(int depth) {
			Token token = input.peekValueToken();
			return switch (token) {
				case NULL -> {
					parseNull();
					yield JsonNull.INSTANCE;
				}
				case TRUE, FALSE -> JsonBoolean.of(parseBoolean());
				case NUMBER -> new JsonNumber(parseNumber());
				case STRING -> new JsonString(parseString());
				case START_ARRAY -> parseArray(depth);
				case START_OBJECT -> parseObject(depth);
				case END_TEXT -> throw noMatch("Unexpected end of input", Production.VALUE);
				default -> throw noMatch("Unexpected " + token, Production.VALUE);
			};
		}

		private JsonArray parseArray(int depth) {
			logEntry("parseArray", depth);
			checkDepth(depth, Production.ARRAY);
			skipToken(START_ARRAY);
			if (nextTokenIs(END_ARRAY)) {
				return JsonArray.EMPTY;
			}
			List<JsonValue> elements = new ArrayList<>();
			do {
				checkInterrupted();
				elements.add(parseValue(depth + 1));
			} while (nextIsCommaOr(END_ARRAY, Production.COMMA_OR_END_ARRAY));
			return new JsonArray(elements);
		}

		private JsonObject parseObject(int depth) {
			logEntry("parseObject", depth);
			checkDepth(depth, Production.OBJECT);
			skipToken(START_OBJECT);
			if (settings.allowEmptyObjects() && nextTokenIs(END_OBJECT)) {
				return new JsonObject(Map.of());
			}
			Map<String, JsonValue> members = new LinkedHashMap<>();
			do {
				checkInterrupted();
				if (input.peekValueToken() != STRING) {
					throw noMatch("Expected member name", Production.MEMBER_NAME);
				}
				String name = parseString();
				if (!nextTokenIs(COLON)) {
					throw noMatch("Expected colon after member name", Production.COLON);
				}
				// Later duplicates overwrite earlier ones
				members.put(name, parseValue(depth + 1));
			} while (nextIsCommaOr(END_OBJECT, Production.COMMA_OR_END_OBJECT));
			return new JsonObject(members);
		}

		private void checkDepth(int depth, Production container) {
			if (depth >= settings.maxDepth()) {
				throw new DepthExceededException(settings.maxDepth(), input.currentOffset(), container);
			}
		}

		/**
		 * @return true after a comma; false after {@code endToken}
		 */
		private boolean nextIsCommaOr(Token endToken, Production expected) {
			if (nextTokenIs(COMMA)) {
				return true;
			} else if (nextTokenIs(endToken)) {
				return false;
			} else {
				throw noMatch("Expected , or " + endToken.literal(), expected);
			}
		}

		private void skipToken(Token expectedToken) {
			boolean found = nextTokenIs(expectedToken);
			assert found: "Caller should have checked for " + expectedToken;
		}

		/**
		 * Consumes the token if it's the expected one.
		 *
		 * @return true if the token was the expected one
		 */
		private boolean nextTokenIs(Token expectedToken) {
			assert expectedToken.isPunctuation();
			if (input.peekValueToken() == expectedToken) {
				input.advance();
				return true;
			} else {
				return false;
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonTreeParser.class);
}
