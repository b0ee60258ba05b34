package works.quarry.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedClass;
import org.junit.jupiter.params.provider.MethodSource;
import works.quarry.AbstractPipelineTest;
import works.quarry.Pipeline;
import works.quarry.PipelineSettings;
import works.quarry.exceptions.JsonSyntaxException;
import works.quarry.text.Coordinate;
import works.quarry.text.Span;
import works.quarry.tree.JsonBoolean;
import works.quarry.tree.JsonNull;
import works.quarry.tree.JsonString;
import works.quarry.tree.JsonValue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.quarry.parser.EventKind.END_ARRAY;
import static works.quarry.parser.EventKind.END_OBJECT;
import static works.quarry.parser.EventKind.KEY;
import static works.quarry.parser.EventKind.SCALAR;
import static works.quarry.parser.EventKind.START_ARRAY;
import static works.quarry.parser.EventKind.START_OBJECT;
import static works.quarry.parser.TreeParserTest.number;

@ParameterizedClass
@MethodSource("fillerSuppliers")
class EventParserTest extends AbstractPipelineTest {

	EventParser parserFor(String json) {
		return parserFor(json, PipelineSettings.DEFAULT);
	}

	EventParser parserFor(String json, PipelineSettings settings) {
		return Pipeline.using(settings).eventParser(fillerFor(json));
	}

	@Test
	void eventSequence() {
		try (EventParser parser = parserFor("{\"a\":1,\"b\":[true,null]}")) {
			assertEquals(List.of(
				ParseEvent.structural(START_OBJECT, span("{", 1, 1, 0)),
				ParseEvent.key("a", span("\"a\"", 1, 2, 1)),
				ParseEvent.scalar(number("1"), span("1", 1, 6, 5)),
				ParseEvent.key("b", span("\"b\"", 1, 8, 7)),
				ParseEvent.structural(START_ARRAY, span("[", 1, 12, 11)),
				ParseEvent.scalar(JsonBoolean.TRUE, span("true", 1, 13, 12)),
				ParseEvent.scalar(JsonNull.INSTANCE, span("null", 1, 18, 17)),
				ParseEvent.structural(END_ARRAY, span("]", 1, 22, 21)),
				ParseEvent.structural(END_OBJECT, span("}", 1, 23, 22))
			), drain(parser));
		}
	}

	@Test
	void eventsCarryTheirTokensExtent() {
		try (EventParser parser = parserFor("{\"key\" :\n  -12.5e3, \"x\": \"caf\u00e9\"}")) {
			List<ParseEvent> events = drain(parser);
			ParseEvent key = events.get(1);
			assertEquals("\"key\"", key.span().text());
			assertEquals(new Coordinate(1, 2, 1), key.coordinate());
			assertEquals(new Coordinate(1, 6, 5), key.end(), "Ends at the closing quote");

			ParseEvent number = events.get(2);
			assertEquals("-12.5e3", number.span().text());
			assertEquals(new Coordinate(2, 3, 11), number.coordinate());
			assertEquals(new Coordinate(2, 9, 17), number.end(), "Ends at the last digit, not the comma");

			ParseEvent string = events.get(4);
			assertEquals("\"caf\u00e9\"", string.span().text());
			assertEquals(new Coordinate(2, 17, 25), string.coordinate());
			assertEquals(new Coordinate(2, 22, 30), string.end(), "Counts code points, not bytes");

			ParseEvent end = events.get(5);
			assertEquals(END_OBJECT, end.kind());
			assertEquals(end.coordinate(), end.end());
		}
	}

	@Test
	void replayPassesSpansThrough() {
		List<Span> spans = new ArrayList<>();
		TreeBuilder builder = new TreeBuilder();
		ParseActions recorder = new ParseActions() {
			@Override
			public void startObject(Span span) {
				spans.add(span);
				builder.startObject(span);
			}

			@Override
			public void endObject(Span span) {
				spans.add(span);
				builder.endObject(span);
			}

			@Override
			public void startArray(Span span) {
				spans.add(span);
				builder.startArray(span);
			}

			@Override
			public void endArray(Span span) {
				spans.add(span);
				builder.endArray(span);
			}

			@Override
			public void key(String key, Span span) {
				spans.add(span);
				builder.key(key, span);
			}

			@Override
			public void scalar(JsonValue value, Span span) {
				spans.add(span);
				builder.scalar(value, span);
			}
		};
		List<ParseEvent> events;
		try (EventParser parser = parserFor("[false, 10]")) {
			events = drain(parser);
		}
		EventParser.replay(events.iterator(), recorder);
		assertEquals(events.stream().map(ParseEvent::span).toList(), spans);
		assertEquals(span("10", 1, 9, 8), spans.get(2));
		assertEquals(Pipeline.withDefaults().parseTree("[false, 10]"), builder.result());
	}

	@Test
	void scalarRoot() {
		try (EventParser parser = parserFor("\"only\"")) {
			assertTrue(parser.hasNext());
			ParseEvent event = parser.next();
			assertEquals(SCALAR, event.kind());
			assertEquals(new JsonString("only"), event.scalar());
			assertFalse(parser.hasNext());
			assertThrows(NoSuchElementException.class, parser::next);
		}
	}

	@Test
	void eventsAreLazy() {
		// The fault is far from the start, so we get some events before we see it
		try (EventParser parser = parserFor("[1, 2, }")) {
			assertEquals(START_ARRAY, parser.next().kind());
			assertEquals(SCALAR, parser.next().kind());
			assertEquals(SCALAR, parser.next().kind());
			JsonSyntaxException e = assertThrows(JsonSyntaxException.class, parser::hasNext);
			assertEquals(Expectation.VALUE_START, e.expected());
			assertSame(e, assertThrows(JsonSyntaxException.class, parser::next), "Fault is sticky");
		}
	}

	@Test
	void trailingTokenIsReportedAfterRootEvents() {
		try (EventParser parser = parserFor("[] 3")) {
			assertEquals(START_ARRAY, parser.next().kind());
			assertEquals(END_ARRAY, parser.next().kind());
			JsonSyntaxException e = assertThrows(JsonSyntaxException.class, parser::hasNext);
			assertEquals(Expectation.END_OF_INPUT, e.expected());
		}
	}

	@Test
	void emptyInput() {
		try (EventParser parser = parserFor("")) {
			JsonSyntaxException e = assertThrows(JsonSyntaxException.class, parser::hasNext);
			assertEquals(Expectation.VALUE_START, e.expected());
		}
	}

	@Test
	void duplicateKeysAreReported() {
		try (EventParser parser = parserFor("{\"k\":1,\"k\":2}")) {
			List<ParseEvent> events = drain(parser);
			assertEquals(2, events.stream().filter(e -> e.kind() == KEY).count());
		}
	}

	@Test
	void duplicateKeys_reject() {
		PipelineSettings settings = PipelineSettings.DEFAULT.withDuplicateKeys(DuplicateKeys.REJECT);
		try (EventParser parser = parserFor("{\"k\":1,\"k\":2}", settings)) {
			assertEquals(START_OBJECT, parser.next().kind());
			assertEquals(KEY, parser.next().kind());
			assertEquals(SCALAR, parser.next().kind());
			JsonSyntaxException e = assertThrows(JsonSyntaxException.class, parser::next);
			assertEquals(Expectation.UNIQUE_KEY, e.expected());
		}
	}

	@Test
	void replayIntoRecorder() {
		List<String> calls = new ArrayList<>();
		ParseActions recorder = new ParseActions() {
			@Override
			public void startObject(Span span) {
				calls.add("{");
			}

			@Override
			public void endObject(Span span) {
				calls.add("}");
			}

			@Override
			public void startArray(Span span) {
				calls.add("[");
			}

			@Override
			public void endArray(Span span) {
				calls.add("]");
			}

			@Override
			public void key(String key, Span span) {
				calls.add(key + ":");
			}

			@Override
			public void scalar(JsonValue value, Span span) {
				calls.add(value.toString());
			}
		};
		try (EventParser parser = parserFor("{\"x\":[false,\"s\"]}")) {
			EventParser.replay(parser, recorder);
		}
		assertEquals(List.of("{", "x:", "[", "false", "\"s\"", "]", "}"), calls);
	}

	static List<ParseEvent> drain(EventParser parser) {
		List<ParseEvent> result = new ArrayList<>();
		parser.forEachRemaining(result::add);
		return result;
	}
}
