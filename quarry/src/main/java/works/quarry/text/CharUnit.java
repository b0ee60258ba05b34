package works.quarry.text;

import static java.util.Objects.requireNonNull;

/**
 * A decoded character together with the place it was found.
 *
 * @param codePoint the Unicode code point, or {@link #END_OF_INPUT}
 */
public record CharUnit(int codePoint, Coordinate coordinate) {
	public static final int END_OF_INPUT = -1;

	public CharUnit {
		requireNonNull(coordinate);
	}

	public static CharUnit endAt(Coordinate coordinate) {
		return new CharUnit(END_OF_INPUT, coordinate);
	}

	public boolean isEnd() {
		return codePoint == END_OF_INPUT;
	}

	@Override
	public String toString() {
		if (isEnd()) {
			return "<end of input> @ " + coordinate;
		}
		return "'" + Character.toString(codePoint) + "' @ " + coordinate;
	}
}
