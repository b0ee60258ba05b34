package works.quarry.parser;

/**
 * What to do when an object contains the same member name more than once.
 * RFC 8259 says names "SHOULD" be unique, so either choice is conforming.
 */
public enum DuplicateKeys {
	/**
	 * The member keeps the position where its name first appeared,
	 * and takes the value that appeared last.
	 */
	LAST_WINS,

	/**
	 * A repeated name is a syntax fault, located at the repeated name,
	 * with {@link Expectation#UNIQUE_KEY} expected.
	 */
	REJECT,
}
