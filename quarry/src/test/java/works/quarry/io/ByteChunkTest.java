package works.quarry.io;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.junit.jupiter.api.Test;
import works.quarry.decoder.Decoder;
import works.quarry.decoder.Encoding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ByteChunkTest {

	@Test
	void windowWithinArray() {
		ByteChunk chunk = new ByteChunk(new byte[5], 1, 4);
		assertEquals(3, chunk.length());
		assertEquals(0, new ByteChunk(new byte[5], 5, 5).length());
	}

	@Test
	void windowOutsideArrayIsRejected() {
		byte[] bytes = new byte[5];
		assertThrows(IndexOutOfBoundsException.class, () -> new ByteChunk(bytes, -1, 2));
		assertThrows(IndexOutOfBoundsException.class, () -> new ByteChunk(bytes, 3, 2));
		assertThrows(IndexOutOfBoundsException.class, () -> new ByteChunk(bytes, 0, 6));
		assertThrows(NullPointerException.class, () -> new ByteChunk(null, 0, 0));
	}

	@Test
	void decoderReadsOnlyTheWindowAndRecyclesEachChunk() {
		// é is C3 A9, split across the chunks; the bytes outside each window are junk
		RecordingFiller filler = new RecordingFiller(
			new ByteChunk(new byte[] {'#', '#', 'a', (byte) 0xC3}, 2, 4),
			new ByteChunk(new byte[] {(byte) 0xA9, 'b', '!', '!'}, 0, 2));
		StringBuilder sb = new StringBuilder();
		try (Decoder decoder = Decoder.create(Encoding.UTF_8, filler)) {
			for (int c = decoder.next(); c != Decoder.END_OF_INPUT; c = decoder.next()) {
				sb.appendCodePoint(c);
			}
			assertEquals(Decoder.END_OF_INPUT, decoder.next());
		}
		assertEquals("a\u00e9b", sb.toString());
		assertEquals(List.of("next", "recycle", "next", "recycle", "next", "close"), filler.calls);
	}

	/**
	 * Serves the given chunks and insists that each is recycled before the next is requested.
	 */
	static final class RecordingFiller implements ChunkFiller {
		final Deque<ByteChunk> chunks;
		final List<String> calls = new ArrayList<>();
		ByteChunk outstanding;

		RecordingFiller(ByteChunk... chunks) {
			this.chunks = new ArrayDeque<>(List.of(chunks));
		}

		@Override
		public ByteChunk nextChunk() {
			if (outstanding != null) {
				throw new IllegalStateException("Previous chunk was not recycled");
			}
			calls.add("next");
			outstanding = chunks.poll();
			return outstanding;
		}

		@Override
		public void recycleChunk(ByteChunk chunk) {
			if (chunk != outstanding) {
				throw new IllegalStateException("Recycled a chunk that was not outstanding");
			}
			calls.add("recycle");
			outstanding = null;
		}

		@Override
		public void close() {
			calls.add("close");
		}
	}
}
