package works.quarry;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import works.quarry.decoder.Encoding;
import works.quarry.exceptions.DecodeException;
import works.quarry.lexer.NumberConverter;
import works.quarry.lexer.NumberMode;
import works.quarry.parser.DuplicateKeys;
import works.quarry.parser.EventKind;
import works.quarry.parser.EventParser;
import works.quarry.parser.ParseEvent;
import works.quarry.parser.TreeParser;
import works.quarry.text.Coordinate;
import works.quarry.tree.JsonArray;
import works.quarry.tree.JsonObject;
import works.quarry.tree.JsonString;
import works.quarry.tree.JsonValue;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.quarry.AbstractPipelineTest.span;

class PipelineTest {

	@Test
	void defaultSettings() {
		PipelineSettings settings = Pipeline.withDefaults().settings();
		assertEquals(Encoding.UTF_8, settings.encoding());
		assertEquals(NumberMode.EAGER, settings.numberMode());
		assertEquals(NumberConverter.DOUBLE, settings.numberConverter());
		assertEquals(DuplicateKeys.LAST_WINS, settings.duplicateKeys());
		assertEquals(false, settings.containerRoot());
	}

	@Test
	void withMethodsChangeOneSetting() {
		PipelineSettings settings = PipelineSettings.DEFAULT
			.withEncoding(Encoding.ASCII)
			.withContainerRoot(true);
		assertEquals(new PipelineSettings(Encoding.ASCII, NumberMode.EAGER, NumberConverter.DOUBLE, DuplicateKeys.LAST_WINS, true), settings);
	}

	@Test
	void parseTreeFromString() {
		JsonValue value = Pipeline.withDefaults().parseTree("{\"greeting\": \"héllo\"}");
		JsonObject object = assertInstanceOf(JsonObject.class, value);
		assertEquals(new JsonString("héllo"), object.get("greeting"));
	}

	@Test
	void parseTreeFromFile(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("doc.json");
		Files.writeString(file, "[1, 2, 3]\n");
		JsonArray array = assertInstanceOf(JsonArray.class, Pipeline.withDefaults().parseTree(file));
		assertEquals(3, array.size());
	}

	@Test
	void eventParserFromFile(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("doc.json");
		Files.writeString(file, "{\"k\": null}");
		try (EventParser parser = Pipeline.withDefaults().eventParser(file)) {
			assertEquals(EventKind.START_OBJECT, parser.next().kind());
			assertEquals(EventKind.KEY, parser.next().kind());
			assertEquals(EventKind.SCALAR, parser.next().kind());
			assertEquals(EventKind.END_OBJECT, parser.next().kind());
		}
	}

	@Test
	void closingParserClosesStream() {
		AtomicBoolean closed = new AtomicBoolean(false);
		ByteArrayInputStream stream = new ByteArrayInputStream("true".getBytes(UTF_8)) {
			@Override
			public void close() {
				closed.set(true);
			}
		};
		try (TreeParser parser = Pipeline.withDefaults().treeParser(stream)) {
			parser.parse();
		}
		assertTrue(closed.get());
	}

	@Test
	void events() {
		List<ParseEvent> events = Pipeline.withDefaults().events("[\"a\"]");
		assertEquals(List.of(
			ParseEvent.structural(EventKind.START_ARRAY, span("[", 1, 1, 0)),
			ParseEvent.scalar(new JsonString("a"), span("\"a\"", 1, 2, 1)),
			ParseEvent.structural(EventKind.END_ARRAY, span("]", 1, 5, 4))
		), events);
	}

	@Test
	void asciiEncoding_rejectsNonAscii() {
		Pipeline ascii = Pipeline.using(PipelineSettings.DEFAULT.withEncoding(Encoding.ASCII));
		assertEquals(new JsonString("plain"), ascii.parseTree("\"plain\""));
		DecodeException e = assertThrows(DecodeException.class, () -> ascii.parseTree("\"café\""));
		assertEquals(new Coordinate(1, 5, 4), e.coordinate());
		assertEquals(4, e.byteOffset());
	}
}
