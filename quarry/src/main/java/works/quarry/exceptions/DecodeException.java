package works.quarry.exceptions;

import works.quarry.text.Coordinate;

/**
 * The input bytes are not valid in the selected encoding.
 */
public final class DecodeException extends QuarryException {
	private final long byteOffset;

	/**
	 * Used by decoders, which know only the byte offset.
	 */
	public DecodeException(String description, long byteOffset) {
		super(description, Coordinate.ofByteOffset(byteOffset));
		this.byteOffset = byteOffset;
	}

	private DecodeException(DecodeException original, Coordinate coordinate) {
		super(original.description(), coordinate, original);
		this.byteOffset = original.byteOffset;
	}

	/**
	 * @return an equivalent fault located at the given character coordinate
	 */
	public DecodeException relocatedTo(Coordinate coordinate) {
		return new DecodeException(this, coordinate);
	}

	/**
	 * @return offset of the offending byte from the start of the input
	 */
	public long byteOffset() {
		return byteOffset;
	}

	@Override
	public FaultKind kind() {
		return FaultKind.DECODE;
	}
}
