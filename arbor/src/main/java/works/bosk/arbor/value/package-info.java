/**
 * The immutable value tree produced by {@link works.bosk.arbor.codec.JsonTreeParser}.
 * <p>
 * {@link works.bosk.arbor.value.JsonValue} is a sealed interface with one record per JSON value kind.
 * Numbers carry a further sealed {@link works.bosk.arbor.value.Num} that records whether the
 * literal was integral or floating-point.
 * All collections in a tree are unmodifiable copies, and records provide
 * structural {@code equals}, {@code hashCode} and a readable {@code toString}.
 */
package works.bosk.arbor.value;
