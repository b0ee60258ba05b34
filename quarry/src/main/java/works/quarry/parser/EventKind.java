package works.quarry.parser;

public enum EventKind {
	START_OBJECT,
	KEY,
	START_ARRAY,
	SCALAR,
	END_OBJECT,
	END_ARRAY,
}
