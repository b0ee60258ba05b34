package works.quarry.io;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A window onto a byte array. Only {@code bytes[start]} through {@code bytes[stop - 1]} are input;
 * whatever lies outside the window belongs to the {@link ChunkFiller} that produced it.
 * <p>
 * The array is shared, not copied. A decoder reads the window and then hands the chunk back
 * through {@link ChunkFiller#recycleChunk}, after which the filler may overwrite it.
 *
 * @param stop exclusive
 * @throws IndexOutOfBoundsException unless {@code 0 <= start <= stop <= bytes.length}
 */
public record ByteChunk(
	byte[] bytes,
	int start,
	int stop
) {
	public ByteChunk {
		requireNonNull(bytes);
		Objects.checkFromToIndex(start, stop, bytes.length);
	}

	public int length() {
		return stop - start;
	}
}
