package works.quarry.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.quarry.text.Span;
import works.quarry.tree.JsonArray;
import works.quarry.tree.JsonObject;
import works.quarry.tree.JsonValue;

/**
 * {@link ParseActions} that materialize a {@link JsonValue} tree,
 * using a stack of frames for the containers still being built.
 * <p>
 * When an object has more than one member with the same name,
 * the member stays where its name first appeared and takes the last value.
 * (With {@link DuplicateKeys#REJECT}, the parser never lets that happen.)
 */
public final class TreeBuilder implements ParseActions {
	private final Deque<Frame> frames = new ArrayDeque<>();
	private JsonValue result;

	private sealed interface Frame permits ObjectFrame, ArrayFrame {
		void add(JsonValue value);
	}

	private static final class ObjectFrame implements Frame {
		final Map<String, JsonValue> members = new LinkedHashMap<>();
		String pendingKey;

		@Override
		public void add(JsonValue value) {
			if (pendingKey == null) {
				throw new IllegalStateException("Object member value without a name");
			}
			JsonValue replaced = members.put(pendingKey, value);
			if (replaced != null) {
				LOGGER.debug("Duplicate member name \"{}\": replacing {} with {}", pendingKey, replaced, value);
			}
			pendingKey = null;
		}
	}

	private static final class ArrayFrame implements Frame {
		final List<JsonValue> elements = new ArrayList<>();

		@Override
		public void add(JsonValue value) {
			elements.add(value);
		}
	}

	@Override
	public void startObject(Span span) {
		checkNotComplete();
		frames.push(new ObjectFrame());
	}

	@Override
	public void endObject(Span span) {
		if (!(frames.peek() instanceof ObjectFrame frame)) {
			throw new IllegalStateException("No object to end at " + span.start());
		}
		frames.pop();
		attach(new JsonObject(frame.members));
	}

	@Override
	public void startArray(Span span) {
		checkNotComplete();
		frames.push(new ArrayFrame());
	}

	@Override
	public void endArray(Span span) {
		if (!(frames.peek() instanceof ArrayFrame frame)) {
			throw new IllegalStateException("No array to end at " + span.start());
		}
		frames.pop();
		attach(new JsonArray(frame.elements));
	}

	@Override
	public void key(String key, Span span) {
		if (!(frames.peek() instanceof ObjectFrame frame) || frame.pendingKey != null) {
			throw new IllegalStateException("Unexpected member name \"" + key + "\" at " + span.start());
		}
		frame.pendingKey = key;
	}

	@Override
	public void scalar(JsonValue value, Span span) {
		checkNotComplete();
		attach(value);
	}

	/**
	 * @throws IllegalStateException if the root value isn't complete
	 */
	public JsonValue result() {
		if (result == null) {
			throw new IllegalStateException("Document is incomplete");
		}
		return result;
	}

	private void attach(JsonValue value) {
		Frame parent = frames.peek();
		if (parent == null) {
			result = value;
		} else {
			parent.add(value);
		}
	}

	private void checkNotComplete() {
		if (result != null) {
			throw new IllegalStateException("Document is already complete");
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TreeBuilder.class);
}
