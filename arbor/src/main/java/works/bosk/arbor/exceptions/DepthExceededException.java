package works.bosk.arbor.exceptions;

import works.bosk.arbor.codec.Production;

/**
 * Arrays and objects are nested more deeply than the configured limit.
 *
 * @see works.bosk.arbor.codec.JsonTreeParser.Settings#maxDepth()
 */
public final class DepthExceededException extends JsonFormatException {
	private final int maxDepth;

	public DepthExceededException(int maxDepth, long offset, Production expected) {
		super("Nesting depth exceeds limit of " + maxDepth, offset, expected);
		this.maxDepth = maxDepth;
	}

	public int maxDepth() {
		return maxDepth;
	}
}
