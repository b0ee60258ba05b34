package works.quarry.decoder;

import works.quarry.exceptions.DecodeException;
import works.quarry.io.ByteChunk;
import works.quarry.io.ChunkFiller;

import static java.util.Objects.requireNonNull;

/**
 * Byte-level plumbing shared by the decoders: walks through the chunks
 * supplied by a {@link ChunkFiller}, one byte at a time, keeping count of the byte offset.
 */
abstract sealed class ChunkDecoder implements Decoder permits Utf8Decoder, AsciiDecoder {
	private final ChunkFiller filler;

	/**
	 * Null until the first byte is requested, and again once the filler is exhausted.
	 */
	private ByteChunk currentChunk;

	/**
	 * The current index within {@link #currentChunk}.
	 * If equal to {@code currentChunk.stop()}, the next byte is in the next chunk (which may not exist).
	 */
	private int currentChunkPos;

	private long byteOffset = 0;
	private boolean isExhausted = false;
	private DecodeException failure;

	ChunkDecoder(ChunkFiller filler) {
		this.filler = requireNonNull(filler);
	}

	@Override
	public final int next() {
		if (failure != null) {
			throw failure;
		}
		return decodeNext();
	}

	/**
	 * @return the next code point, or {@link #END_OF_INPUT}
	 */
	abstract int decodeNext();

	/**
	 * @return the next byte as an unsigned value, or -1 at the end of the input
	 */
	final int nextByte() {
		while (currentChunk == null || currentChunkPos >= currentChunk.stop()) {
			if (!nextChunk()) {
				return -1;
			}
		}
		byteOffset++;
		return currentChunk.bytes()[currentChunkPos++] & 0xFF;
	}

	/**
	 * Records the fault so that later calls to {@link #next()} rethrow it.
	 *
	 * @return the exception for the caller to throw
	 */
	final DecodeException fault(String description, long offset) {
		failure = new DecodeException(description, offset);
		return failure;
	}

	private boolean nextChunk() {
		if (isExhausted) {
			return false;
		}
		if (currentChunk != null) {
			filler.recycleChunk(currentChunk);
		}
		currentChunk = filler.nextChunk();
		if (currentChunk == null) {
			isExhausted = true;
			return false;
		} else {
			currentChunkPos = currentChunk.start();
			return true;
		}
	}

	@Override
	public final long byteOffset() {
		return byteOffset;
	}

	@Override
	public void close() {
		filler.close();
	}

	static String hex(int b) {
		return String.format("0x%02X", b);
	}
}
