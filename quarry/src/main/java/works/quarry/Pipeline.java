package works.quarry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.quarry.decoder.Decoder;
import works.quarry.io.ByteArrayChunkFiller;
import works.quarry.io.ChunkFiller;
import works.quarry.io.SynchronousChunkFiller;
import works.quarry.lexer.Lexer;
import works.quarry.parser.EventParser;
import works.quarry.parser.ParseEvent;
import works.quarry.parser.TreeParser;
import works.quarry.scanner.Scanner;
import works.quarry.tree.JsonValue;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Assembles the stages of the pipeline according to some {@link PipelineSettings}.
 * <p>
 * Every stage is created on top of a fresh copy of the stages below it,
 * so the objects returned here each own their input,
 * and closing one closes the byte source beneath it.
 * <p>
 * Strings are always supplied to the decoder as UTF-8,
 * so with {@link works.quarry.decoder.Encoding#ASCII ASCII},
 * any non-ASCII character in a string is a decode fault.
 */
public final class Pipeline {
	private final PipelineSettings settings;

	private Pipeline(PipelineSettings settings) {
		this.settings = requireNonNull(settings);
	}

	public static Pipeline using(PipelineSettings settings) {
		return new Pipeline(settings);
	}

	public static Pipeline withDefaults() {
		return using(PipelineSettings.DEFAULT);
	}

	public PipelineSettings settings() {
		return settings;
	}

	//
	// Stages
	//

	public Decoder decoder(ChunkFiller filler) {
		return Decoder.create(settings.encoding(), filler);
	}

	public Scanner scanner(ChunkFiller filler) {
		return new Scanner(decoder(filler));
	}

	public Lexer lexer(ChunkFiller filler) {
		return new Lexer(scanner(filler), settings.numberMode(), settings.numberConverter());
	}

	public TreeParser treeParser(ChunkFiller filler) {
		LOGGER.debug("Creating tree parser with {}", settings);
		return new TreeParser(lexer(filler), settings.duplicateKeys(), settings.containerRoot());
	}

	public EventParser eventParser(ChunkFiller filler) {
		LOGGER.debug("Creating event parser with {}", settings);
		return new EventParser(lexer(filler), settings.duplicateKeys(), settings.containerRoot());
	}

	//
	// Convenience overloads for common inputs
	//

	public Lexer lexer(byte[] bytes) {
		return lexer(new ByteArrayChunkFiller(bytes));
	}

	public Lexer lexer(String json) {
		return lexer(json.getBytes(UTF_8));
	}

	public TreeParser treeParser(byte[] bytes) {
		return treeParser(new ByteArrayChunkFiller(bytes));
	}

	public TreeParser treeParser(String json) {
		return treeParser(json.getBytes(UTF_8));
	}

	/**
	 * Closing the returned parser closes {@code stream}.
	 */
	public TreeParser treeParser(InputStream stream) {
		return treeParser(new SynchronousChunkFiller(stream));
	}

	/**
	 * The caller is responsible for closing the returned parser, which closes the file.
	 */
	public TreeParser treeParser(Path file) throws IOException {
		return treeParser(Files.newInputStream(file));
	}

	public EventParser eventParser(byte[] bytes) {
		return eventParser(new ByteArrayChunkFiller(bytes));
	}

	public EventParser eventParser(String json) {
		return eventParser(json.getBytes(UTF_8));
	}

	/**
	 * Closing the returned parser closes {@code stream}.
	 */
	public EventParser eventParser(InputStream stream) {
		return eventParser(new SynchronousChunkFiller(stream));
	}

	/**
	 * The caller is responsible for closing the returned parser, which closes the file.
	 */
	public EventParser eventParser(Path file) throws IOException {
		return eventParser(Files.newInputStream(file));
	}

	//
	// One-shot operations
	//

	public JsonValue parseTree(String json) {
		try (TreeParser parser = treeParser(json)) {
			return parser.parse();
		}
	}

	public JsonValue parseTree(Path file) throws IOException {
		try (TreeParser parser = treeParser(file)) {
			return parser.parse();
		}
	}

	/**
	 * @return every event in {@code json}, in order
	 */
	public List<ParseEvent> events(String json) {
		List<ParseEvent> result = new ArrayList<>();
		try (EventParser parser = eventParser(json)) {
			parser.forEachRemaining(result::add);
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Pipeline.class);
}
