package works.quarry.io;

/**
 * A simple {@link ChunkFiller} that returns a single chunk backed by a given byte array.
 */
public class ByteArrayChunkFiller implements ChunkFiller {
	final ByteChunk chunk;
	boolean isConsumed;

	public ByteArrayChunkFiller(byte[] bytes) {
		this.chunk = new ByteChunk(bytes, 0, bytes.length);
		// An empty array means no chunks at all
		this.isConsumed = (bytes.length == 0);
	}

	@Override
	public ByteChunk nextChunk() {
		if (isConsumed) {
			return null;
		}
		isConsumed = true;
		return chunk;
	}

	@Override
	public void recycleChunk(ByteChunk chunk) {
		assert chunk == this.chunk;
	}

	@Override
	public void close() {
		// Nothing to do
	}
}
