package works.quarry.lexer;

/**
 * The lexical classes of JSON text.
 * <p>
 * {@link #WHITESPACE} and {@link #ERROR} classify characters for the lexer's own dispatch;
 * they never appear in a {@link Token}.
 */
public enum TokenKind {
	END_TEXT,
	NULL,
	FALSE,
	TRUE,
	NUMBER,
	START_OBJECT,
	END_OBJECT,
	START_ARRAY,
	END_ARRAY,

	/**
	 * Can be a member name or a string value.
	 * We don't distinguish at the token level.
	 */
	STRING,

	COMMA,
	COLON,
	WHITESPACE,

	ERROR;

	/**
	 * @return the lexical class of a token whose first character is {@code codePoint}
	 */
	public static TokenKind startingWith(int codePoint) {
		return switch (codePoint) {
			case -1 -> END_TEXT;
			case 'n' -> NULL;
			case 'f' -> FALSE;
			case 't' -> TRUE;
			case '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', '-' -> NUMBER;
			case '{' -> START_OBJECT;
			case '}' -> END_OBJECT;
			case '[' -> START_ARRAY;
			case ']' -> END_ARRAY;
			case '"' -> STRING;
			case ',' -> COMMA;
			case ':' -> COLON;
			case 0x20, 0x0A, 0x0D, 0x09 -> WHITESPACE;
			default -> ERROR;
		};
	}

	/**
	 * @return true for tokens that are always represented in JSON with the same sequence of characters
	 */
	public boolean hasFixedRepresentation() {
		return switch (this) {
			case END_TEXT,
				 NULL, FALSE, TRUE,
				 START_OBJECT, END_OBJECT, START_ARRAY, END_ARRAY,
				 COMMA, COLON ->
				true;
			default ->
				false;
		};
	}

	public String fixedRepresentation() {
		return switch (this) {
			case END_TEXT -> "";
			case NULL -> "null";
			case FALSE -> "false";
			case TRUE -> "true";
			case START_OBJECT -> "{";
			case END_OBJECT -> "}";
			case START_ARRAY -> "[";
			case END_ARRAY -> "]";
			case COMMA -> ",";
			case COLON -> ":";
			default ->
				throw new IllegalArgumentException("Token has no fixed representation: " + this);
		};
	}
}
