package works.quarry.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * A {@link ChunkFiller} that reads chunks on demand from an {@link InputStream},
 * on the caller's thread.
 * <p>
 * Calling {@link #close()} will close the underlying stream.
 */
public class SynchronousChunkFiller implements ChunkFiller {
	public static final int DEFAULT_BUFFER_SIZE = 40_000;

	final InputStream stream;
	final byte[] buffer;

	public SynchronousChunkFiller(InputStream stream) {
		this(stream, DEFAULT_BUFFER_SIZE);
	}

	/**
	 * Small buffers are mostly useful for testing chunk boundaries.
	 */
	public SynchronousChunkFiller(InputStream stream, int bufferSize) {
		if (bufferSize < 1) {
			throw new IllegalArgumentException("Buffer size must be positive: " + bufferSize);
		}
		this.stream = stream;
		buffer = new byte[bufferSize];
	}

	@Override
	public ByteChunk nextChunk() {
		int length;
		try {
			do {
				length = stream.read(buffer, 0, buffer.length);
			} while (length == 0);
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to read input", e);
		}
		if (length == -1) {
			return null;
		}

		return new ByteChunk(buffer, 0, length);
	}

	@Override
	public void recycleChunk(ByteChunk chunk) {
		assert chunk.bytes() == this.buffer;
	}

	@Override
	public void close() {
		try {
			stream.close();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}
}
