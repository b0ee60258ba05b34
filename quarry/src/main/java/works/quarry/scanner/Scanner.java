package works.quarry.scanner;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import works.quarry.decoder.Decoder;
import works.quarry.exceptions.DecodeException;
import works.quarry.exceptions.ScanException;
import works.quarry.text.CharUnit;
import works.quarry.text.Coordinate;
import works.quarry.text.Span;

import static java.util.Objects.requireNonNull;

/**
 * Character-level navigation over a {@link Decoder}, with coordinates.
 * <p>
 * Three holding areas are involved, and the rules for moving characters among them
 * are stringent:
 * <ul>
 *     <li>
 *         The <em>scan buffer</em> holds characters that have been {@link #advance advanced}
 *         but not yet {@link #take taken}. Its contents are always the text of the token
 *         currently being assembled.
 *     </li>
 *     <li>
 *         The <em>pushback stack</em> holds characters returned by {@link #pushback}.
 *         When non-empty, it is drained before anything new is pulled from the decoder.
 *     </li>
 *     <li>
 *         The <em>lookahead slot</em> holds at most one character that has been
 *         {@link #lookahead peeked} from the decoder but not yet advanced.
 *     </li>
 * </ul>
 * Each character is given its coordinate when it is first pulled from the decoder,
 * and keeps it no matter how often it is pushed back and advanced again.
 */
public final class Scanner implements AutoCloseable {
	private final Decoder decoder;

	private final List<CharUnit> buffer = new ArrayList<>();

	/**
	 * For each entry in {@link #buffer}, the value {@link #position} had before it was advanced.
	 * Lets {@link #pushback} restore the position exactly.
	 */
	private final List<Coordinate> priorPositions = new ArrayList<>();

	private final Deque<CharUnit> pushbacks = new ArrayDeque<>();

	/**
	 * Null when empty.
	 */
	private CharUnit lookahead;

	/**
	 * Coordinate of the most recently advanced character that hasn't been pushed back.
	 */
	private Coordinate position = Coordinate.START;

	/**
	 * Coordinate to be given to the next character pulled from the decoder.
	 */
	private Coordinate nextCoordinate = Coordinate.FIRST;

	public Scanner(Decoder decoder) {
		this.decoder = requireNonNull(decoder);
	}

	/**
	 * Moves the next character onto the end of the scan buffer.
	 * Pushed-back characters come first, then the lookahead slot, then the decoder.
	 *
	 * @return the character just advanced
	 * @throws ScanException if the input is exhausted
	 * @throws DecodeException if the decoder fails
	 */
	public CharUnit advance() {
		CharUnit unit;
		if (!pushbacks.isEmpty()) {
			unit = pushbacks.pop();
		} else if (lookahead != null) {
			unit = lookahead;
			lookahead = null;
		} else {
			unit = pull();
		}
		if (unit.isEnd()) {
			// Leave the end marker where lookahead() will find it again
			lookahead = unit;
			throw new ScanException("Unexpected end of input", unit.coordinate());
		}
		priorPositions.add(position);
		buffer.add(unit);
		position = unit.coordinate();
		return unit;
	}

	/**
	 * Moves the most recently advanced character from the scan buffer
	 * onto the pushback stack, so the next {@link #advance} will return it again.
	 *
	 * @throws ScanException if the scan buffer is empty
	 */
	public void pushback() {
		if (buffer.isEmpty()) {
			throw new ScanException("Nothing to push back", position);
		}
		int last = buffer.size() - 1;
		pushbacks.push(buffer.remove(last));
		position = priorPositions.remove(last);
	}

	/**
	 * Peeks at the next character without advancing.
	 * Calling this repeatedly without an intervening {@link #advance} returns the same unit.
	 *
	 * @return the next character, or an {@link CharUnit#isEnd() end} unit at the end of input
	 * @throws DecodeException if the decoder fails
	 */
	public CharUnit lookahead() {
		if (!pushbacks.isEmpty()) {
			return pushbacks.peek();
		}
		if (lookahead == null) {
			lookahead = pull();
		}
		return lookahead;
	}

	/**
	 * Returns the contents of the scan buffer and clears it, marking a token boundary.
	 */
	public Span take() {
		Span result;
		if (buffer.isEmpty()) {
			result = new Span("", position, position);
		} else {
			StringBuilder sb = new StringBuilder(buffer.size());
			for (CharUnit unit : buffer) {
				sb.appendCodePoint(unit.codePoint());
			}
			result = new Span(sb.toString(), buffer.get(0).coordinate(), buffer.get(buffer.size() - 1).coordinate());
		}
		clearBuffer();
		return result;
	}

	/**
	 * Clears the scan buffer without producing any text.
	 * Useful for characters, like whitespace, that belong to no token.
	 */
	public void discard() {
		clearBuffer();
	}

	/**
	 * @return the coordinate of the most recently advanced character,
	 * or {@link Coordinate#START} if there isn't one
	 */
	public Coordinate currentCoordinate() {
		return position;
	}

	/**
	 * @return the scan buffer's current contents, without clearing it. Useful for diagnostics.
	 */
	public String bufferedText() {
		StringBuilder sb = new StringBuilder(buffer.size());
		for (CharUnit unit : buffer) {
			sb.appendCodePoint(unit.codePoint());
		}
		return sb.toString();
	}

	/**
	 * @return the number of characters in the scan buffer
	 */
	public int bufferedLength() {
		return buffer.size();
	}

	private void clearBuffer() {
		buffer.clear();
		priorPositions.clear();
	}

	private CharUnit pull() {
		int codePoint;
		try {
			codePoint = decoder.next();
		} catch (DecodeException e) {
			throw e.relocatedTo(nextCoordinate);
		}
		if (codePoint == Decoder.END_OF_INPUT) {
			return CharUnit.endAt(nextCoordinate);
		}
		CharUnit result = new CharUnit(codePoint, nextCoordinate);
		nextCoordinate = nextCoordinate.following(codePoint);
		return result;
	}

	/**
	 * Closes the underlying {@link Decoder}.
	 */
	@Override
	public void close() {
		decoder.close();
	}
}
