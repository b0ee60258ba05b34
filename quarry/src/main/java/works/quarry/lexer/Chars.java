package works.quarry.lexer;

import java.util.stream.LongStream;

/**
 * Character classification for the lexer.
 */
final class Chars {
	private static final long WHITESPACE_CHARS = LongStream
		.of(0x20, 0x0A, 0x0D, 0x09)
		.map(n -> 1L << n)
		.sum();

	/**
	 * Characters that may legally follow a number or keyword, besides whitespace and end of input.
	 */
	private static final long DELIMITER_CHARS = LongStream
		.of(',', ':')
		.map(n -> 1L << n)
		.sum();

	private Chars() {}

	static boolean isWhitespace(int codePoint) {
		return 0 <= codePoint && codePoint < 64 && (WHITESPACE_CHARS & (1L << codePoint)) != 0;
	}

	/**
	 * @return true if a number or keyword may end just before {@code codePoint}
	 */
	static boolean isDelimiter(int codePoint) {
		if (codePoint == -1 || codePoint == ']' || codePoint == '}') {
			return true;
		}
		return isWhitespace(codePoint)
			|| (0 <= codePoint && codePoint < 64 && (DELIMITER_CHARS & (1L << codePoint)) != 0);
	}

	static boolean isNumberChar(int c) {
		return (c >= '0' && c <= '9') || c == '.' || c == '-' || c == '+' || c == 'e' || c == 'E';
	}

	static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	/**
	 * @return a readable rendering of {@code codePoint} for diagnostics
	 */
	static String describe(int codePoint) {
		if (codePoint == -1) {
			return "end of input";
		} else if (codePoint < 0x20 || codePoint == 0x7F) {
			return String.format("U+%04X", codePoint);
		} else {
			return "'" + Character.toString(codePoint) + "'";
		}
	}
}
