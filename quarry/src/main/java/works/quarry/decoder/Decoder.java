package works.quarry.decoder;

import works.quarry.exceptions.DecodeException;
import works.quarry.io.ChunkFiller;

/**
 * Turns bytes from a {@link ChunkFiller} into a lazy, finite, non-restartable
 * sequence of Unicode code points.
 * <p>
 * Each call to {@link #next()} decodes exactly one character directly from the
 * underlying chunk's bytes; nothing is staged in an intermediate buffer.
 * Once {@link #END_OF_INPUT} has been returned, every later call returns it again.
 * Once a {@link DecodeException} has been thrown, every later call throws it again.
 */
public sealed interface Decoder extends AutoCloseable permits ChunkDecoder {
	int END_OF_INPUT = -1;

	static Decoder create(Encoding encoding, ChunkFiller filler) {
		return switch (encoding) {
			case UTF_8 -> new Utf8Decoder(filler);
			case ASCII -> new AsciiDecoder(filler);
		};
	}

	/**
	 * @return the next code point, or {@link #END_OF_INPUT}
	 * @throws DecodeException if the bytes are invalid in this decoder's encoding
	 */
	int next();

	/**
	 * @return the number of bytes consumed from the input so far
	 */
	long byteOffset();

	Encoding encoding();

	/**
	 * Closes the underlying {@link ChunkFiller}.
	 */
	@Override void close(); // No throws Exception
}
