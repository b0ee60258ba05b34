package works.quarry;

import java.io.ByteArrayInputStream;
import java.util.function.Function;
import java.util.stream.Stream;
import org.junit.jupiter.params.Parameter;
import works.quarry.io.ByteArrayChunkFiller;
import works.quarry.io.ChunkFiller;
import works.quarry.io.SynchronousChunkFiller;
import works.quarry.text.Coordinate;
import works.quarry.text.Span;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Base for tests that should behave identically no matter how the input bytes are chunked.
 * Subclasses are annotated with
 * {@code @ParameterizedClass} and {@code @MethodSource("fillerSuppliers")}.
 */
public class AbstractPipelineTest {
	@Parameter
	protected Function<byte[], ? extends ChunkFiller> fillerSupplier;

	protected ChunkFiller fillerFor(byte[] bytes) {
		return fillerSupplier.apply(bytes);
	}

	protected ChunkFiller fillerFor(String json) {
		return fillerFor(json.getBytes(UTF_8));
	}

	/**
	 * The span of a token that sits on a single line.
	 */
	public static Span span(String text, long line, long column, long offset) {
		long last = text.codePointCount(0, text.length()) - 1;
		return new Span(text, new Coordinate(line, column, offset), new Coordinate(line, column + last, offset + last));
	}

	@SuppressWarnings("unused") // Subclasses use this to parameterize tests
	public static Stream<Function<byte[], ? extends ChunkFiller>> fillerSuppliers() {
		return Stream.of(
			new WholeArray(),
			new TinyChunks()
		);
	}

	static class WholeArray implements Function<byte[], ChunkFiller> {
		@Override
		public ChunkFiller apply(byte[] bytes) {
			return new ByteArrayChunkFiller(bytes);
		}

		@Override
		public String toString() {
			return "Whole array";
		}
	}

	/**
	 * One byte per chunk, so every multi-byte sequence straddles a chunk boundary.
	 */
	static class TinyChunks implements Function<byte[], ChunkFiller> {
		@Override
		public ChunkFiller apply(byte[] bytes) {
			return new SynchronousChunkFiller(new ByteArrayInputStream(bytes), 1);
		}

		@Override
		public String toString() {
			return "Tiny chunks";
		}
	}
}
