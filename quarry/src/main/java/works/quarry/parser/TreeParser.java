package works.quarry.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.quarry.lexer.Lexer;
import works.quarry.tree.JsonValue;

/**
 * The tree front-end: parses an entire document into a {@link JsonValue}.
 */
public final class TreeParser implements AutoCloseable {
	private final TreeBuilder builder = new TreeBuilder();
	private final GrammarDriver driver;

	public TreeParser(Lexer lexer) {
		this(lexer, DuplicateKeys.LAST_WINS, false);
	}

	/**
	 * @param containerRoot if true, the document must be an object or array
	 */
	public TreeParser(Lexer lexer, DuplicateKeys duplicateKeys, boolean containerRoot) {
		this.driver = new GrammarDriver(lexer, builder, duplicateKeys, containerRoot);
	}

	/**
	 * Consumes the entire input, up to and including the end-of-input token.
	 * Calling this again returns the same value, or throws the same fault.
	 *
	 * @return the document
	 * @throws works.quarry.exceptions.QuarryException if the input is not a single valid JSON value
	 */
	public JsonValue parse() {
		while (driver.step()) {
			// Keep going
		}
		JsonValue result = builder.result();
		LOGGER.trace("Parsed {}", result.getClass().getSimpleName());
		return result;
	}

	@Override
	public void close() {
		driver.close();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TreeParser.class);
}
