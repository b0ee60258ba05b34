package works.quarry.lexer;

import works.quarry.text.Coordinate;
import works.quarry.text.Span;

import static java.util.Objects.requireNonNull;

/**
 * A lexical unit of JSON text.
 * <p>
 * String and number tokens carry their decoded payload, so nobody downstream needs to rescan them:
 * {@code string} is the unescaped value of a {@link TokenKind#STRING STRING},
 * and {@code numeral} is the payload of a {@link TokenKind#NUMBER NUMBER}.
 * Both are null for every other kind.
 *
 * @param span the token's raw text and where it starts and ends; for {@link TokenKind#END_TEXT END_TEXT},
 *             an empty span just past the last character
 */
public record Token(
	TokenKind kind,
	Span span,
	String string,
	Numeral numeral
) {
	public Token {
		requireNonNull(kind);
		requireNonNull(span);
		assert (kind == TokenKind.STRING) == (string != null): "Only STRING tokens have string values";
		assert (kind == TokenKind.NUMBER) == (numeral != null): "Only NUMBER tokens have numerals";
	}

	public static Token fixed(TokenKind kind, Span span) {
		if (!kind.hasFixedRepresentation()) {
			throw new IllegalArgumentException("Token kind needs a payload: " + kind);
		}
		return new Token(kind, span, null, null);
	}

	public static Token string(String value, Span span) {
		return new Token(TokenKind.STRING, span, requireNonNull(value), null);
	}

	public static Token number(Numeral numeral, Span span) {
		return new Token(TokenKind.NUMBER, span, null, requireNonNull(numeral));
	}

	/**
	 * @return where the token's first character is
	 */
	public Coordinate coordinate() {
		return span.start();
	}

	/**
	 * @return where the token's last character is
	 */
	public Coordinate end() {
		return span.end();
	}

	public String stringValue() {
		if (string == null) {
			throw new IllegalStateException("Not a string token: " + this);
		}
		return string;
	}

	public Numeral numeralValue() {
		if (numeral == null) {
			throw new IllegalStateException("Not a number token: " + this);
		}
		return numeral;
	}

	@Override
	public String toString() {
		return switch (kind) {
			case STRING -> "STRING(\"" + string + "\") @ " + span.start();
			case NUMBER -> "NUMBER(" + numeral + ") @ " + span.start();
			default -> kind + " @ " + span.start();
		};
	}
}
