package works.bosk.arbor.codec;

/**
 * What the parser was trying to recognize when it gave up.
 * Reported by {@link works.bosk.arbor.exceptions.JsonFormatException#expected()}.
 */
public enum Production {
	VALUE,
	NULL,
	BOOLEAN,
	NUMBER,
	STRING,
	ARRAY,
	OBJECT,
	MEMBER_NAME,
	COLON,
	COMMA_OR_END_ARRAY,
	COMMA_OR_END_OBJECT,
	END_OF_TEXT,
}
