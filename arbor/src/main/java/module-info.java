/**
 * Arbor parses JSON text held in memory into an immutable tree of typed values.
 * <p>
 * The major packages are:
 *
 * <ul>
 *     <li>
 *         {@link works.bosk.arbor.value},
 *         the sealed {@link works.bosk.arbor.value.JsonValue JsonValue} tree;
 *     </li>
 *     <li>
 *         {@link works.bosk.arbor.codec},
 *         which holds the {@link works.bosk.arbor.codec.JsonTreeParser parser} and its settings; and
 *     </li>
 *     <li>
 *         {@link works.bosk.arbor.exceptions},
 *         describing why a text was rejected and where.
 *     </li>
 * </ul>
 */
module works.bosk.arbor {
	requires org.slf4j;

	exports works.bosk.arbor.codec;
	exports works.bosk.arbor.exceptions;
	exports works.bosk.arbor.value;
}
