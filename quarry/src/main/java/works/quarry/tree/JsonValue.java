package works.quarry.tree;

/**
 * A JSON document, or any value within one.
 * <p>
 * Values are immutable, and their {@code equals} is structural,
 * so two trees parsed from equivalent text compare equal.
 * {@link #toString()} renders compact JSON text.
 */
public sealed interface JsonValue permits
	JsonObject,
	JsonArray,
	JsonString,
	JsonNumber,
	JsonBoolean,
	JsonNull
{
}
