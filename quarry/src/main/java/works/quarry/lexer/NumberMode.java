package works.quarry.lexer;

/**
 * When the lexer hands number text to its {@link NumberConverter}.
 */
public enum NumberMode {
	/**
	 * Convert as soon as the number is lexed. Conversion faults surface from the lexer immediately.
	 */
	EAGER,

	/**
	 * Keep the text and convert on the first call to {@link Numeral#value()}.
	 * Documents whose numbers are never read skip the conversion entirely,
	 * at the cost of surfacing conversion faults only when a value is read.
	 */
	LAZY,
}
