package works.quarry.exceptions;

import works.quarry.lexer.TokenKind;
import works.quarry.parser.Expectation;
import works.quarry.text.Coordinate;

import static java.util.Objects.requireNonNull;

/**
 * The token sequence is not valid JSON:
 * a token arrived that the grammar does not allow in the parser's current state.
 */
public final class JsonSyntaxException extends QuarryException {
	private final TokenKind found;
	private final Expectation expected;

	public JsonSyntaxException(String description, Coordinate coordinate, TokenKind found, Expectation expected) {
		super(description, coordinate);
		this.found = requireNonNull(found);
		this.expected = requireNonNull(expected);
	}

	/**
	 * @return the kind of the offending token
	 */
	public TokenKind found() {
		return found;
	}

	/**
	 * @return what the grammar would have accepted instead
	 */
	public Expectation expected() {
		return expected;
	}

	@Override
	public FaultKind kind() {
		return FaultKind.SYNTAX;
	}
}
