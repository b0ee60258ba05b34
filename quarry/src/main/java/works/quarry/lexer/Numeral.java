package works.quarry.lexer;

import works.quarry.exceptions.LexicalException;
import works.quarry.text.Coordinate;

import static java.util.Objects.requireNonNull;

/**
 * The payload of a {@link TokenKind#NUMBER NUMBER} token:
 * the number's text as it appeared in the input, plus its converted value.
 * <p>
 * The conversion happens at most once. Depending on the lexer's {@link NumberMode},
 * that's either while the token is lexed, or on the first call to {@link #value()}.
 * Equality is based on the text alone, so comparing numerals never forces a conversion.
 */
public final class Numeral {
	private final String text;
	private final Coordinate coordinate;
	private final NumberConverter converter;

	private Number value;
	private LexicalException failure;

	public Numeral(String text, Coordinate coordinate, NumberConverter converter) {
		this.text = requireNonNull(text);
		this.coordinate = requireNonNull(coordinate);
		this.converter = requireNonNull(converter);
	}

	/**
	 * @return the number's text exactly as it appeared in the input
	 */
	public String text() {
		return text;
	}

	public Coordinate coordinate() {
		return coordinate;
	}

	/**
	 * @return true if {@link #value()} has already been computed successfully
	 */
	public boolean isConverted() {
		return value != null;
	}

	/**
	 * @throws LexicalException if the converter rejects the text, fails in any other way,
	 * or returns null; located at the number's first character
	 */
	public Number value() {
		if (value == null) {
			if (failure != null) {
				throw failure;
			}
			Number result;
			try {
				result = converter.convert(text);
			} catch (RuntimeException e) {
				failure = new LexicalException("Invalid number [" + text + "]: " + e.getMessage(), coordinate, e);
				throw failure;
			}
			if (result == null) {
				failure = new LexicalException("Number converter produced no value for [" + text + "]", coordinate);
				throw failure;
			}
			value = result;
		}
		return value;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Numeral other && text.equals(other.text);
	}

	@Override
	public int hashCode() {
		return text.hashCode();
	}

	@Override
	public String toString() {
		return text;
	}
}
