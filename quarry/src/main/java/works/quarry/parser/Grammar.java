package works.quarry.parser;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import works.quarry.lexer.TokenKind;

import static java.util.Map.entry;
import static works.quarry.lexer.TokenKind.COLON;
import static works.quarry.lexer.TokenKind.COMMA;
import static works.quarry.lexer.TokenKind.END_ARRAY;
import static works.quarry.lexer.TokenKind.END_OBJECT;
import static works.quarry.lexer.TokenKind.END_TEXT;
import static works.quarry.lexer.TokenKind.FALSE;
import static works.quarry.lexer.TokenKind.NULL;
import static works.quarry.lexer.TokenKind.NUMBER;
import static works.quarry.lexer.TokenKind.START_ARRAY;
import static works.quarry.lexer.TokenKind.START_OBJECT;
import static works.quarry.lexer.TokenKind.STRING;
import static works.quarry.lexer.TokenKind.TRUE;

/**
 * The JSON grammar as a single transition table over {@link TokenKind}s.
 * Both parser front-ends are driven by this table via {@link GrammarDriver},
 * so they can't disagree about what's valid.
 */
public final class Grammar {
	private Grammar() {}

	/**
	 * This state machine is designed to avoid unnecessary pushes and pops,
	 * in the sense that something like "[1,2,3]" only requires one push and one pop
	 * to start and end the array.
	 */
	public enum State {
		AT_VALUE,
		AT_ROOT_CONTAINER,      // Like AT_VALUE, but scalars aren't allowed
		AT_FIRST_MEMBER,        // Might be absent, for an empty object
		AT_MEMBER,              // Can't be absent: we've seen a comma
		AT_COLON,
		AT_MEMBER_VALUE,
		AT_COMMA_OR_END_OBJECT,
		AT_FIRST_ELEMENT,        // Might be absent, for an empty array
		AT_ELEMENT,              // Can't be absent: we've seen a comma
		AT_COMMA_OR_END_ARRAY,

		/**
		 * Pseudo-state indicating a state should be popped off the stack.
		 * Also used as a kind of "terminator" when we expect to be at the end of input.
		 */
		DONE_VALUE,
		;

		static final Map<State, Map<TokenKind, State>> TRANSITIONS = Collections.unmodifiableMap(new EnumMap<>(Map.ofEntries(
			entry(AT_VALUE, table(Map.of(
				START_OBJECT,  AT_FIRST_MEMBER,
				START_ARRAY,   AT_FIRST_ELEMENT,
				STRING,        DONE_VALUE,
				NUMBER,        DONE_VALUE,
				TRUE,          DONE_VALUE,
				FALSE,         DONE_VALUE,
				NULL,          DONE_VALUE
			))),
			entry(AT_ROOT_CONTAINER, table(Map.of(
				START_OBJECT,  AT_FIRST_MEMBER,
				START_ARRAY,   AT_FIRST_ELEMENT
			))),
			entry(AT_MEMBER, table(Map.of(
				STRING, AT_COLON
			))),
			entry(AT_FIRST_MEMBER, table(Map.of(
				STRING,      AT_COLON,
				END_OBJECT,  DONE_VALUE
			))),
			entry(AT_COLON, table(Map.of(
				COLON, AT_MEMBER_VALUE
			))),
			entry(AT_MEMBER_VALUE, table(Map.of(
				START_OBJECT,  AT_FIRST_MEMBER,
				START_ARRAY,   AT_FIRST_ELEMENT,
				STRING,        AT_COMMA_OR_END_OBJECT,
				NUMBER,        AT_COMMA_OR_END_OBJECT,
				TRUE,          AT_COMMA_OR_END_OBJECT,
				FALSE,         AT_COMMA_OR_END_OBJECT,
				NULL,          AT_COMMA_OR_END_OBJECT
			))),
			entry(AT_COMMA_OR_END_OBJECT, table(Map.of(
				COMMA,       AT_MEMBER,
				END_OBJECT,  DONE_VALUE
			))),
			entry(AT_ELEMENT, table(Map.of(
				START_OBJECT, AT_FIRST_MEMBER,
				START_ARRAY,  AT_FIRST_ELEMENT,
				STRING,       AT_COMMA_OR_END_ARRAY,
				NUMBER,       AT_COMMA_OR_END_ARRAY,
				TRUE,         AT_COMMA_OR_END_ARRAY,
				FALSE,        AT_COMMA_OR_END_ARRAY,
				NULL,         AT_COMMA_OR_END_ARRAY
			))),
			entry(AT_FIRST_ELEMENT, table(Map.of(
				START_OBJECT,  AT_FIRST_MEMBER,
				START_ARRAY,   AT_FIRST_ELEMENT,
				STRING,        AT_COMMA_OR_END_ARRAY,
				NUMBER,        AT_COMMA_OR_END_ARRAY,
				TRUE,          AT_COMMA_OR_END_ARRAY,
				FALSE,         AT_COMMA_OR_END_ARRAY,
				NULL,          AT_COMMA_OR_END_ARRAY,
				END_ARRAY,     DONE_VALUE
			))),
			entry(AT_COMMA_OR_END_ARRAY, table(Map.of(
				COMMA,      AT_ELEMENT,
				END_ARRAY,  DONE_VALUE
			))),
			entry(DONE_VALUE, table(Map.of(
				END_TEXT, DONE_VALUE
			)))
		)));

		private static Map<TokenKind, State> table(Map<TokenKind, State> transitions) {
			return Collections.unmodifiableMap(new EnumMap<>(transitions));
		}

		public static State initial(boolean containerRoot) {
			return containerRoot ? AT_ROOT_CONTAINER : AT_VALUE;
		}

		/**
		 * @return the tokens accepted in this state, and the state each one leads to; unmodifiable
		 */
		public Map<TokenKind, State> transitions() {
			return TRANSITIONS.get(this);
		}

		/**
		 * @return the state to resume once a container entered from this state has been closed
		 */
		State afterValue() {
			return switch (this) {
				case AT_VALUE, AT_ROOT_CONTAINER -> DONE_VALUE;
				case AT_MEMBER_VALUE -> AT_COMMA_OR_END_OBJECT;
				case AT_FIRST_ELEMENT, AT_ELEMENT -> AT_COMMA_OR_END_ARRAY;
				default -> throw new IllegalStateException("No value can start in state " + this);
			};
		}

		public Expectation expectation() {
			return switch (this) {
				case AT_VALUE, AT_MEMBER_VALUE, AT_ELEMENT -> Expectation.VALUE_START;
				case AT_ROOT_CONTAINER -> Expectation.CONTAINER_START;
				case AT_FIRST_MEMBER -> Expectation.KEY_OR_END_OBJECT;
				case AT_MEMBER -> Expectation.KEY;
				case AT_COLON -> Expectation.COLON;
				case AT_COMMA_OR_END_OBJECT -> Expectation.COMMA_OR_END_OBJECT;
				case AT_FIRST_ELEMENT -> Expectation.VALUE_OR_END_ARRAY;
				case AT_COMMA_OR_END_ARRAY -> Expectation.COMMA_OR_END_ARRAY;
				case DONE_VALUE -> Expectation.END_OF_INPUT;
			};
		}
	}
}
