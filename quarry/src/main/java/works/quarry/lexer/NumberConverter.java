package works.quarry.lexer;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Turns the text of a JSON number into a Java {@link Number}.
 * <p>
 * The lexer has already checked the text against the JSON number grammar,
 * so implementations are concerned only with range and representation.
 * Implementations must be pure functions.
 */
@FunctionalInterface
public interface NumberConverter {
	/**
	 * @throws NumberFormatException if the number can't be represented
	 */
	Number convert(String text);

	/**
	 * Every number becomes a {@code double}.
	 * Numbers too large in magnitude to be finite doubles are rejected.
	 */
	NumberConverter DOUBLE = text -> {
		double result = Double.parseDouble(text);
		if (Double.isInfinite(result)) {
			throw new NumberFormatException("Out of range for double: " + text);
		}
		return result;
	};

	/**
	 * Integral text becomes a {@code long} if it fits;
	 * everything else is handled as {@link #DOUBLE} would.
	 */
	NumberConverter MIXED = text -> {
		if (isIntegral(text)) {
			BigInteger integer = new BigInteger(text);
			if (integer.bitLength() < Long.SIZE) {
				return integer.longValue();
			}
		}
		return DOUBLE.convert(text);
	};

	/**
	 * Exact decimal representation of any number.
	 */
	NumberConverter BIG_DECIMAL = BigDecimal::new;

	private static boolean isIntegral(String text) {
		for (int i = 0; i < text.length(); i++) {
			switch (text.charAt(i)) {
				case '.', 'e', 'E' -> {
					return false;
				}
				default -> { }
			}
		}
		return true;
	}
}
