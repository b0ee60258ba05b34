package works.quarry.tree;

import static java.util.Objects.requireNonNull;

/**
 * @param value the unescaped string
 */
public record JsonString(String value) implements JsonValue {
	public JsonString {
		requireNonNull(value);
	}

	@Override
	public String toString() {
		return quoted(value);
	}

	static String quoted(String value) {
		StringBuilder sb = new StringBuilder(value.length() + 2);
		sb.append('"');
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			switch (c) {
				case '"' -> sb.append("\\\"");
				case '\\' -> sb.append("\\\\");
				case '\b' -> sb.append("\\b");
				case '\f' -> sb.append("\\f");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				default -> {
					if (c < 0x20) {
						sb.append(String.format("\\u%04x", (int) c));
					} else {
						sb.append(c);
					}
				}
			}
		}
		return sb.append('"').toString();
	}
}
