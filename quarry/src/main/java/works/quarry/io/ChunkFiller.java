package works.quarry.io;

/**
 * Where a {@link works.quarry.decoder.Decoder Decoder} gets its bytes.
 * <p>
 * The decoder asks for one chunk at a time, reads it to the end,
 * and returns it with {@link #recycleChunk} before asking for the next.
 * A filler can therefore refill a single buffer over and over.
 * Once {@link #nextChunk} has returned null, the decoder asks no more,
 * and it closes the filler when it is closed itself.
 */
public interface ChunkFiller extends AutoCloseable {
	/**
	 * @return a chunk with at least one byte, or null when the input is used up
	 * @throws java.io.UncheckedIOException if reading the underlying source fails
	 */
	ByteChunk nextChunk();

	/**
	 * @param chunk the chunk most recently returned by {@link #nextChunk}; the caller no longer reads it
	 */
	void recycleChunk(ByteChunk chunk);

	/**
	 * Releases the underlying source. Failures are unchecked.
	 */
	@Override
	void close();
}
