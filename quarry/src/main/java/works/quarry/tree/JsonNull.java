package works.quarry.tree;

public enum JsonNull implements JsonValue {
	INSTANCE;

	@Override
	public String toString() {
		return "null";
	}
}
