package works.quarry.decoder;

import works.quarry.io.ChunkFiller;

/**
 * Decodes UTF-8 by bit-twiddling.
 * <p>
 * The leading byte's high bits give the length of the sequence,
 * and each continuation byte contributes its low six bits.
 * Validation is minimal: we catch malformed leading and continuation bytes,
 * sequences cut short by the end of input, and values beyond {@link Character#MAX_CODE_POINT},
 * but we don't reject overlong encodings or encoded surrogates.
 */
public final class Utf8Decoder extends ChunkDecoder {
	public Utf8Decoder(ChunkFiller filler) {
		super(filler);
	}

	@Override
	int decodeNext() {
		long leadOffset = byteOffset();
		int b = nextByte();
		if (b == -1) {
			return END_OF_INPUT;
		}
		if ((b & 0x80) == 0) {
			// ASCII fast path
			return b;
		}

		// The first byte tells us how long a sequence we're dealing with
		int codePoint;
		int sequenceLength;
		if ((b & 0xE0) == 0xC0) {
			sequenceLength = 2;
			codePoint = b & 0x1F;
		} else if ((b & 0xF0) == 0xE0) {
			sequenceLength = 3;
			codePoint = b & 0x0F;
		} else if ((b & 0xF8) == 0xF0) {
			sequenceLength = 4;
			codePoint = b & 0x07;
		} else if ((b & 0xC0) == 0x80) {
			throw fault("Unexpected UTF-8 continuation byte " + hex(b), leadOffset);
		} else {
			throw fault("Invalid UTF-8 start byte " + hex(b), leadOffset);
		}

		for (int i = 1; i < sequenceLength; i++) {
			long offset = byteOffset();
			int bx = nextByte();
			if (bx == -1) {
				throw fault("Truncated " + sequenceLength + "-byte UTF-8 sequence", leadOffset);
			}
			if ((bx & 0xC0) != 0x80) {
				throw fault("Invalid UTF-8 continuation byte " + hex(bx), offset);
			}
			codePoint = (codePoint << 6) | (bx & 0x3F);
		}

		if (codePoint > Character.MAX_CODE_POINT) {
			throw fault("UTF-8 sequence encodes U+" + Integer.toHexString(codePoint).toUpperCase()
				+ ", beyond the Unicode range", leadOffset);
		}
		return codePoint;
	}

	@Override
	public Encoding encoding() {
		return Encoding.UTF_8;
	}
}
