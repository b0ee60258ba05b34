package works.quarry.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.quarry.exceptions.JsonSyntaxException;
import works.quarry.exceptions.QuarryException;
import works.quarry.lexer.Lexer;
import works.quarry.lexer.Token;
import works.quarry.lexer.TokenKind;
import works.quarry.parser.Grammar.State;
import works.quarry.tree.JsonBoolean;
import works.quarry.tree.JsonNull;
import works.quarry.tree.JsonNumber;
import works.quarry.tree.JsonString;

import static java.util.Objects.requireNonNull;

/**
 * Pulls tokens from a {@link Lexer} one at a time, validates each against the {@link Grammar},
 * and reports the resulting structural transitions to a {@link ParseActions}.
 * <p>
 * Each {@link #step} consumes exactly one token and makes at most one call on the actions.
 * The front-ends differ only in what they plug in as actions, and in how eagerly they step.
 */
final class GrammarDriver implements AutoCloseable {
	private final Lexer lexer;
	private final ParseActions actions;
	private final DuplicateKeys duplicateKeys;
	private final Deque<State> stack = new ArrayDeque<>(); // "Dormant" states besides the current state

	/**
	 * For {@link DuplicateKeys#REJECT}, the names seen so far in each open object, innermost first.
	 */
	private final Deque<Set<String>> keySets = new ArrayDeque<>();

	/**
	 * Effectively the top of the stack; kept separately
	 * because we often want to {@link #transitionTo} a new state without a pop+push.
	 */
	private State currentState;

	private boolean finished = false;
	private QuarryException failure;

	GrammarDriver(Lexer lexer, ParseActions actions, DuplicateKeys duplicateKeys, boolean containerRoot) {
		this.lexer = requireNonNull(lexer);
		this.actions = requireNonNull(actions);
		this.duplicateKeys = requireNonNull(duplicateKeys);
		this.currentState = State.initial(containerRoot);
	}

	/**
	 * Consumes one token.
	 *
	 * @return false if the document is complete and the end of input has been reached;
	 * true if there may be more to do
	 * @throws QuarryException from this or any lower stage; every later call throws it again
	 */
	boolean step() {
		if (failure != null) {
			throw failure;
		}
		if (finished) {
			return false;
		}
		try {
			return doStep();
		} catch (QuarryException e) {
			failure = e;
			throw e;
		}
	}

	private boolean doStep() {
		Token token = lexer.next();
		Map<TokenKind, State> transitions = currentState.transitions();
		State nextState = transitions.get(token.kind());
		if (nextState == null) {
			throw new JsonSyntaxException(
				"Unexpected " + describe(token) + "; expected " + currentState.expectation().description(),
				token.coordinate(),
				token.kind(),
				currentState.expectation());
		}
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("{} --{}--> {}", currentState, token.kind(), nextState);
		}
		if (token.kind() == TokenKind.END_TEXT) {
			finished = true;
			return false;
		}
		boolean isKey = (nextState == State.AT_COLON);
		if (isKey) {
			checkUniqueKey(token);
		}
		doStateTransition(transitions, nextState);
		act(token, isKey);
		return true;
	}

	/**
	 * Depending on the next state, perform the appropriate stack manipulation.
	 */
	private void doStateTransition(Map<TokenKind, State> transitions, State nextState) {
		switch (nextState) {
			case AT_FIRST_MEMBER, AT_FIRST_ELEMENT -> {
				// We're "recursing" into an object/array. When it's closed, we'll pop,
				// and we'll want the state to be what it should be after reading a value.
				transitionTo(currentState.afterValue());
				push(nextState);
			}
			case DONE_VALUE -> pop();
			default -> transitionTo(nextState);
		}
	}

	private void act(Token token, boolean isKey) {
		switch (token.kind()) {
			case START_OBJECT -> {
				if (duplicateKeys == DuplicateKeys.REJECT) {
					keySets.push(new HashSet<>());
				}
				actions.startObject(token.span());
			}
			case END_OBJECT -> {
				if (duplicateKeys == DuplicateKeys.REJECT) {
					keySets.pop();
				}
				actions.endObject(token.span());
			}
			case START_ARRAY -> actions.startArray(token.span());
			case END_ARRAY -> actions.endArray(token.span());
			case STRING -> {
				if (isKey) {
					actions.key(token.stringValue(), token.span());
				} else {
					actions.scalar(new JsonString(token.stringValue()), token.span());
				}
			}
			case NUMBER -> actions.scalar(new JsonNumber(token.numeralValue()), token.span());
			case TRUE, FALSE -> actions.scalar(JsonBoolean.of(token.kind() == TokenKind.TRUE), token.span());
			case NULL -> actions.scalar(JsonNull.INSTANCE, token.span());
			case COMMA, COLON -> { }
			default -> throw new AssertionError("Unexpected token kind accepted by grammar: " + token.kind());
		}
	}

	private void checkUniqueKey(Token token) {
		if (duplicateKeys == DuplicateKeys.REJECT && !keySets.element().add(token.stringValue())) {
			throw new JsonSyntaxException(
				"Duplicate member name \"" + token.stringValue() + "\"",
				token.coordinate(),
				token.kind(),
				Expectation.UNIQUE_KEY);
		}
	}

	private void push(State state) {
		stack.push(currentState);
		currentState = state;
	}

	private void pop() {
		if (stack.isEmpty()) {
			currentState = State.DONE_VALUE;
		} else {
			currentState = stack.pop();
		}
	}

	private void transitionTo(State nextState) {
		currentState = nextState;
	}

	private static String describe(Token token) {
		return switch (token.kind()) {
			case END_TEXT -> "end of input";
			case STRING -> "string";
			case NUMBER -> "number " + token.numeralValue();
			default -> "'" + token.kind().fixedRepresentation() + "'";
		};
	}

	@Override
	public void close() {
		lexer.close();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(GrammarDriver.class);
}
