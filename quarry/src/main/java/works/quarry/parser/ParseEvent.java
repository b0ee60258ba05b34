package works.quarry.parser;

import works.quarry.text.Coordinate;
import works.quarry.text.Span;
import works.quarry.tree.JsonValue;

import static java.util.Objects.requireNonNull;

/**
 * One structural step of a parse, as delivered by {@link EventParser}.
 *
 * @param key the member name, for {@link EventKind#KEY KEY} events only; otherwise null
 * @param scalar the value, for {@link EventKind#SCALAR SCALAR} events only; otherwise null
 * @param span the raw text and extent of the token that caused this event
 */
public record ParseEvent(
	EventKind kind,
	String key,
	JsonValue scalar,
	Span span
) {
	public ParseEvent {
		requireNonNull(kind);
		requireNonNull(span);
		assert (kind == EventKind.KEY) == (key != null): "Only KEY events have keys";
		assert (kind == EventKind.SCALAR) == (scalar != null): "Only SCALAR events have scalars";
	}

	public static ParseEvent structural(EventKind kind, Span span) {
		if (kind == EventKind.KEY || kind == EventKind.SCALAR) {
			throw new IllegalArgumentException("Event kind needs a payload: " + kind);
		}
		return new ParseEvent(kind, null, null, span);
	}

	public static ParseEvent key(String key, Span span) {
		return new ParseEvent(EventKind.KEY, requireNonNull(key), null, span);
	}

	public static ParseEvent scalar(JsonValue value, Span span) {
		return new ParseEvent(EventKind.SCALAR, null, requireNonNull(value), span);
	}

	public Coordinate coordinate() {
		return span.start();
	}

	/**
	 * @return the coordinate of the last character of the token behind this event,
	 * such as the closing quote of a key
	 */
	public Coordinate end() {
		return span.end();
	}

	/**
	 * Makes the {@link ParseActions} call this event represents.
	 */
	public void replayTo(ParseActions actions) {
		switch (kind) {
			case START_OBJECT -> actions.startObject(span);
			case END_OBJECT -> actions.endObject(span);
			case START_ARRAY -> actions.startArray(span);
			case END_ARRAY -> actions.endArray(span);
			case KEY -> actions.key(key, span);
			case SCALAR -> actions.scalar(scalar, span);
		}
	}

	@Override
	public String toString() {
		return switch (kind) {
			case KEY -> "KEY(\"" + key + "\") @ " + span.start();
			case SCALAR -> "SCALAR(" + scalar + ") @ " + span.start();
			default -> kind + " @ " + span.start();
		};
	}
}
