package works.quarry.text;

import java.util.Comparator;

/**
 * A position in the decoded input.
 *
 * @param line   1-based line number
 * @param column 1-based column within the line; zero only for {@link #START}
 * @param offset 0-based count of decoded characters (code points) preceding this position.
 *               This is authoritative; {@code line} and {@code column} are derived from it
 *               by newline tracking.
 */
public record Coordinate(long line, long column, long offset) implements Comparable<Coordinate> {
	/**
	 * Where we are before anything has been read.
	 */
	public static final Coordinate START = new Coordinate(1, 0, 0);

	/**
	 * The coordinate of the first character of any input.
	 */
	public static final Coordinate FIRST = new Coordinate(1, 1, 0);

	/**
	 * Offset first. Line and column only break ties, which happens between {@link #START}
	 * and {@link #FIRST}, and between character and byte-offset coordinates.
	 */
	private static final Comparator<Coordinate> ORDER = Comparator
		.comparingLong(Coordinate::offset)
		.thenComparingLong(Coordinate::line)
		.thenComparingLong(Coordinate::column);

	public Coordinate {
		if (line < 0 || column < 0 || offset < 0) {
			throw new IllegalArgumentException("Coordinate components must be non-negative: " + line + ", " + column + ", " + offset);
		}
	}

	/**
	 * Used for faults detected below the character level, where only a byte offset is known.
	 * Line and column are zero.
	 */
	public static Coordinate ofByteOffset(long byteOffset) {
		return new Coordinate(0, 0, byteOffset);
	}

	/**
	 * @return the coordinate of the character that follows one at this position
	 * whose code point is {@code codePoint}
	 */
	public Coordinate following(int codePoint) {
		if (codePoint == '\n') {
			return new Coordinate(line + 1, 1, offset + 1);
		} else {
			return new Coordinate(line, column + 1, offset + 1);
		}
	}

	@Override
	public int compareTo(Coordinate other) {
		return ORDER.compare(this, other);
	}

	@Override
	public String toString() {
		return "line " + line + ", column " + column + " (offset " + offset + ")";
	}
}
