package works.quarry.tree;

import works.quarry.exceptions.LexicalException;
import works.quarry.lexer.Numeral;

import static java.util.Objects.requireNonNull;

/**
 * Equality compares the number's source text, not its converted value,
 * so {@code 1.0} and {@code 1} are different numbers.
 */
public record JsonNumber(Numeral numeral) implements JsonValue {
	public JsonNumber {
		requireNonNull(numeral);
	}

	/**
	 * If the number was lexed lazily, this is where it gets converted.
	 *
	 * @throws LexicalException if the conversion fails
	 */
	public Number value() {
		return numeral.value();
	}

	public String text() {
		return numeral.text();
	}

	@Override
	public String toString() {
		return numeral.text();
	}
}
