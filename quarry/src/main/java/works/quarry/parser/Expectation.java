package works.quarry.parser;

/**
 * What the grammar would have accepted at the point a syntax fault occurred.
 */
public enum Expectation {
	VALUE_START("a value"),
	CONTAINER_START("an object or array"),
	KEY_OR_END_OBJECT("a member name or '}'"),
	KEY("a member name"),
	COLON("':'"),
	COMMA_OR_END_OBJECT("',' or '}'"),
	VALUE_OR_END_ARRAY("a value or ']'"),
	COMMA_OR_END_ARRAY("',' or ']'"),
	END_OF_INPUT("end of input"),
	UNIQUE_KEY("a member name not already used in this object"),
	;

	private final String description;

	Expectation(String description) {
		this.description = description;
	}

	public String description() {
		return description;
	}
}
