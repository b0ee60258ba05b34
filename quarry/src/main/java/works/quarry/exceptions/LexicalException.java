package works.quarry.exceptions;

import works.quarry.text.Coordinate;

/**
 * The characters at some position don't form a valid token.
 */
public final class LexicalException extends QuarryException {
	public LexicalException(String description, Coordinate coordinate) {
		super(description, coordinate);
	}

	public LexicalException(String description, Coordinate coordinate, Throwable cause) {
		super(description, coordinate, cause);
	}

	@Override
	public FaultKind kind() {
		return FaultKind.LEXICAL;
	}
}
