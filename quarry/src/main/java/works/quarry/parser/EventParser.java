package works.quarry.parser;

import java.util.Iterator;
import java.util.NoSuchElementException;
import works.quarry.lexer.Lexer;
import works.quarry.text.Span;
import works.quarry.tree.JsonValue;

/**
 * The event front-end: a lazy, non-restartable sequence of {@link ParseEvent}s.
 * <p>
 * Each event is produced only when asked for, so a fault late in the input
 * surfaces only after all the events before it have been delivered.
 * The sequence ends once the root value is complete and the end of input has been confirmed.
 * {@link #hasNext()} and {@link #next()} throw any fault encountered along the way.
 */
public final class EventParser implements Iterator<ParseEvent>, AutoCloseable {
	private final GrammarDriver driver;
	private ParseEvent pending;

	public EventParser(Lexer lexer) {
		this(lexer, DuplicateKeys.LAST_WINS, false);
	}

	/**
	 * @param containerRoot if true, the document must be an object or array
	 */
	public EventParser(Lexer lexer, DuplicateKeys duplicateKeys, boolean containerRoot) {
		this.driver = new GrammarDriver(lexer, new Collector(), duplicateKeys, containerRoot);
	}

	@Override
	public boolean hasNext() {
		while (pending == null && driver.step()) {
			// Commas and colons produce no event
		}
		return pending != null;
	}

	@Override
	public ParseEvent next() {
		if (!hasNext()) {
			throw new NoSuchElementException();
		}
		ParseEvent result = pending;
		pending = null;
		return result;
	}

	/**
	 * Feeds {@code events} to {@code actions} in order.
	 * With a {@link TreeBuilder}, this reconstructs the tree the {@link TreeParser}
	 * would have produced from the same input.
	 */
	public static void replay(Iterator<ParseEvent> events, ParseActions actions) {
		while (events.hasNext()) {
			events.next().replayTo(actions);
		}
	}

	@Override
	public void close() {
		driver.close();
	}

	private final class Collector implements ParseActions {
		@Override
		public void startObject(Span span) {
			pending = ParseEvent.structural(EventKind.START_OBJECT, span);
		}

		@Override
		public void endObject(Span span) {
			pending = ParseEvent.structural(EventKind.END_OBJECT, span);
		}

		@Override
		public void startArray(Span span) {
			pending = ParseEvent.structural(EventKind.START_ARRAY, span);
		}

		@Override
		public void endArray(Span span) {
			pending = ParseEvent.structural(EventKind.END_ARRAY, span);
		}

		@Override
		public void key(String key, Span span) {
			pending = ParseEvent.key(key, span);
		}

		@Override
		public void scalar(JsonValue value, Span span) {
			pending = ParseEvent.scalar(value, span);
		}
	}
}
