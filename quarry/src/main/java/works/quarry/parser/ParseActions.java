package works.quarry.parser;

import works.quarry.text.Span;
import works.quarry.tree.JsonValue;

/**
 * Receives the structural transitions of a parse, in document order.
 * <p>
 * {@link GrammarDriver} guarantees the calls are well nested:
 * every {@link #startObject} is matched by an {@link #endObject},
 * every value inside an object is preceded by exactly one {@link #key},
 * and the root value is reported exactly once.
 * Implementations used with {@link EventParser#replay} get the same guarantee
 * only if the events came from a parser.
 * <p>
 * Each call carries the {@link Span} of the token behind it: its raw text as it appeared in the input,
 * and the coordinates of its first and last characters.
 */
public interface ParseActions {
	void startObject(Span span);

	void endObject(Span span);

	void startArray(Span span);

	void endArray(Span span);

	void key(String key, Span span);

	/**
	 * @param value a {@link works.quarry.tree.JsonString}, {@link works.quarry.tree.JsonNumber},
	 *              {@link works.quarry.tree.JsonBoolean} or {@link works.quarry.tree.JsonNull}
	 */
	void scalar(JsonValue value, Span span);
}
