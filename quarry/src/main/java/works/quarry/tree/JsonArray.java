package works.quarry.tree;

import java.util.List;
import java.util.stream.Collectors;

public record JsonArray(List<JsonValue> elements) implements JsonValue {
	public JsonArray {
		elements = List.copyOf(elements);
	}

	public static JsonArray of(JsonValue... elements) {
		return new JsonArray(List.of(elements));
	}

	public JsonValue get(int index) {
		return elements.get(index);
	}

	public int size() {
		return elements.size();
	}

	@Override
	public String toString() {
		return elements.stream()
			.map(JsonValue::toString)
			.collect(Collectors.joining(",", "[", "]"));
	}
}
