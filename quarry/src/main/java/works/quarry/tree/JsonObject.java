package works.quarry.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * @param members in the order their keys first appeared
 */
public record JsonObject(Map<String, JsonValue> members) implements JsonValue {
	public JsonObject {
		members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
	}

	public static JsonObject empty() {
		return new JsonObject(Map.of());
	}

	/**
	 * @return the member named {@code key}, or null if there is none
	 */
	public JsonValue get(String key) {
		return members.get(key);
	}

	public int size() {
		return members.size();
	}

	@Override
	public String toString() {
		return members.entrySet().stream()
			.map(e -> JsonString.quoted(e.getKey()) + ":" + e.getValue())
			.collect(Collectors.joining(",", "{", "}"));
	}
}
