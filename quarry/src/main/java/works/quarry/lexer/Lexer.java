package works.quarry.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.quarry.exceptions.LexicalException;
import works.quarry.exceptions.QuarryException;
import works.quarry.scanner.Scanner;
import works.quarry.text.CharUnit;
import works.quarry.text.Coordinate;
import works.quarry.text.Span;

import static java.util.Objects.requireNonNull;
import static works.quarry.lexer.Chars.describe;
import static works.quarry.lexer.Chars.isDigit;

/**
 * Assembles the characters from a {@link Scanner} into {@link Token}s.
 * <p>
 * Whitespace between tokens is skipped. Once the input is exhausted,
 * every call returns an {@link TokenKind#END_TEXT END_TEXT} token.
 * Once a fault has occurred, every call rethrows it.
 */
public final class Lexer implements AutoCloseable {
	private final Scanner scanner;
	private final NumberMode numberMode;
	private final NumberConverter numberConverter;

	private Token peeked;
	private QuarryException failure;

	public Lexer(Scanner scanner) {
		this(scanner, NumberMode.EAGER, NumberConverter.DOUBLE);
	}

	public Lexer(Scanner scanner, NumberMode numberMode, NumberConverter numberConverter) {
		this.scanner = requireNonNull(scanner);
		this.numberMode = requireNonNull(numberMode);
		this.numberConverter = requireNonNull(numberConverter);
	}

	/**
	 * @return the next token, consuming it
	 */
	public Token next() {
		if (peeked != null) {
			Token result = peeked;
			peeked = null;
			return result;
		}
		return produce();
	}

	/**
	 * @return the token the next call to {@link #next()} will return
	 */
	public Token peek() {
		if (peeked == null) {
			peeked = produce();
		}
		return peeked;
	}

	private Token produce() {
		if (failure != null) {
			throw failure;
		}
		try {
			Token result = lex();
			if (LOGGER.isTraceEnabled()) {
				LOGGER.trace("Token {}", result);
			}
			return result;
		} catch (QuarryException e) {
			failure = e;
			throw e;
		}
	}

	private Token lex() {
		skipWhitespace();
		CharUnit first = scanner.lookahead();
		TokenKind kind = TokenKind.startingWith(first.codePoint());
		return switch (kind) {
			case END_TEXT -> Token.fixed(TokenKind.END_TEXT, new Span("", first.coordinate(), first.coordinate()));
			case START_OBJECT, END_OBJECT, START_ARRAY, END_ARRAY, COMMA, COLON -> {
				scanner.advance();
				yield Token.fixed(kind, scanner.take());
			}
			case STRING -> lexString();
			case NUMBER -> lexNumber();
			case TRUE, FALSE, NULL -> lexKeyword(kind);
			case WHITESPACE -> throw new AssertionError("Whitespace should have been skipped");
			case ERROR -> throw new LexicalException("Unexpected character " + describe(first.codePoint()), first.coordinate());
		};
	}

	private void skipWhitespace() {
		while (Chars.isWhitespace(scanner.lookahead().codePoint())) {
			scanner.advance();
		}
		scanner.discard();
	}

	//
	// Strings
	//

	private Token lexString() {
		Coordinate start = scanner.advance().coordinate();
		StringBuilder sb = new StringBuilder();
		while (true) {
			CharUnit unit = advanceWithinString(start);
			int c = unit.codePoint();
			if (c == '"') {
				break;
			} else if (c == '\\') {
				appendEscape(sb, unit.coordinate(), start);
			} else if (c < 0x20) {
				throw new LexicalException("Unescaped control character " + describe(c) + " in string", unit.coordinate());
			} else {
				sb.appendCodePoint(c);
			}
		}
		return Token.string(sb.toString(), scanner.take());
	}

	/**
	 * @param start the coordinate of the opening quote, where an unterminated string is reported
	 */
	private CharUnit advanceWithinString(Coordinate start) {
		if (scanner.lookahead().isEnd()) {
			throw new LexicalException("Unterminated string", start);
		}
		return scanner.advance();
	}

	private void appendEscape(StringBuilder sb, Coordinate backslash, Coordinate start) {
		CharUnit escape = advanceWithinString(start);
		switch (escape.codePoint()) {
			case '"' -> sb.append('"');
			case '\\' -> sb.append('\\');
			case '/' -> sb.append('/');
			case 'b' -> sb.append('\b');
			case 'f' -> sb.append('\f');
			case 'n' -> sb.append('\n');
			case 'r' -> sb.append('\r');
			case 't' -> sb.append('\t');
			case 'u' -> sb.append(unicodeEscape(start));
			default -> throw new LexicalException("Invalid escape sequence \\" + Character.toString(escape.codePoint()), backslash);
		}
	}

	/**
	 * Surrogate pairs need no special treatment: each half becomes one UTF-16 char,
	 * and two adjacent halves make a valid pair in the resulting string.
	 */
	private char unicodeEscape(Coordinate start) {
		int result = 0;
		for (int i = 0; i < 4; i++) {
			CharUnit unit = advanceWithinString(start);
			int digit = hexValue(unit.codePoint());
			if (digit < 0) {
				throw new LexicalException("Invalid hex digit " + describe(unit.codePoint()) + " in unicode escape", unit.coordinate());
			}
			result = (result << 4) | digit;
		}
		return (char) result;
	}

	private static int hexValue(int c) {
		if ('0' <= c && c <= '9') {
			return c - '0';
		} else if ('a' <= c && c <= 'f') {
			return c - 'a' + 10;
		} else if ('A' <= c && c <= 'F') {
			return c - 'A' + 10;
		} else {
			return -1;
		}
	}

	//
	// Numbers
	//

	private Token lexNumber() {
		Coordinate start = scanner.lookahead().coordinate();
		while (!scanner.lookahead().isEnd()) {
			CharUnit unit = scanner.advance();
			if (!Chars.isNumberChar(unit.codePoint())) {
				scanner.pushback();
				break;
			}
		}
		Span span = scanner.take();
		String text = span.text();
		validateJsonNumber(text, start);
		expectDelimiter("number", text);
		Numeral numeral = new Numeral(text, start, numberConverter);
		if (numberMode == NumberMode.EAGER) {
			numeral.value();
		}
		return Token.number(numeral, span);
	}

	private static void validateJsonNumber(String text, Coordinate start) {
		try {
			int i = 0;
			if (text.charAt(0) == '-') {
				i++;
			}
			switch (text.charAt(i)) {
				case '0' -> {
					i++;
					if (i == text.length()) {
						return;
					}
				}
				case '1', '2', '3', '4', '5', '6', '7', '8', '9' -> {
					do {
						i++;
						if (i == text.length()) {
							return;
						}
					} while (isDigit(text.charAt(i)));
				}
				default -> throw new LexicalException(
					"Invalid leading character in number: '" + text + "'", start
				);
			}
			if (text.charAt(i) == '.') {
				i++;
				if (!isDigit(text.charAt(i))) {
					throw new LexicalException(
						"Invalid fractional part in number: '" + text + "'", start
					);
				}
				do {
					i++;
					if (i == text.length()) {
						return;
					}
				} while (isDigit(text.charAt(i)));
			}
			if (text.charAt(i) == 'e' || text.charAt(i) == 'E') {
				i++;
				if (text.charAt(i) == '+' || text.charAt(i) == '-') {
					i++;
				}
				if (!isDigit(text.charAt(i))) {
					throw new LexicalException(
						"Invalid exponent part in number: '" + text + "'", start
					);
				}
				do {
					i++;
					if (i == text.length()) {
						return;
					}
				} while (isDigit(text.charAt(i)));
			}
			throw new LexicalException(
				"Invalid trailing characters in number: '" + text + "'", start
			);
		} catch (IndexOutOfBoundsException e) {
			throw new LexicalException("Unexpected end of number: '" + text + "'", start, e);
		}
	}

	//
	// Keywords
	//

	private Token lexKeyword(TokenKind kind) {
		String expected = kind.fixedRepresentation();
		for (int i = 0; i < expected.length(); i++) {
			CharUnit unit = scanner.lookahead();
			if (unit.codePoint() != expected.charAt(i)) {
				throw new LexicalException(
					"Unexpected " + describe(unit.codePoint()) + " while reading \"" + expected + "\"",
					unit.coordinate());
			}
			scanner.advance();
		}
		expectDelimiter("literal", expected);
		return Token.fixed(kind, scanner.take());
	}

	private void expectDelimiter(String what, String text) {
		CharUnit next = scanner.lookahead();
		if (!Chars.isDelimiter(next.codePoint())) {
			throw new LexicalException(
				"Unexpected character " + describe(next.codePoint()) + " after " + what + " '" + text + "'",
				next.coordinate());
		}
	}

	/**
	 * Closes the underlying {@link Scanner}.
	 */
	@Override
	public void close() {
		scanner.close();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Lexer.class);
}
