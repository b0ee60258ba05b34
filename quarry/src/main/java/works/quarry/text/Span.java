package works.quarry.text;

/**
 * A run of consecutive characters taken from the scanner.
 *
 * @param start coordinate of the first character; for an empty span,
 *              the scanner's position at the time the span was taken
 * @param end   coordinate of the last character; equal to {@code start} for an empty span
 */
public record Span(String text, Coordinate start, Coordinate end) {
	public boolean isEmpty() {
		return text.isEmpty();
	}
}
