package works.quarry.decoder;

import works.quarry.io.ChunkFiller;

/**
 * Strict 7-bit ASCII: each byte is one character, and any byte with the high bit set is a fault.
 */
public final class AsciiDecoder extends ChunkDecoder {
	public AsciiDecoder(ChunkFiller filler) {
		super(filler);
	}

	@Override
	int decodeNext() {
		long offset = byteOffset();
		int b = nextByte();
		if (b == -1) {
			return END_OF_INPUT;
		}
		if ((b & 0x80) != 0) {
			throw fault("Non-ASCII byte " + hex(b), offset);
		}
		return b;
	}

	@Override
	public Encoding encoding() {
		return Encoding.ASCII;
	}
}
