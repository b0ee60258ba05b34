package works.quarry.exceptions;

import works.quarry.text.Coordinate;

/**
 * The scanner was asked to do something its buffers can't support,
 * like advancing past the end of input or pushing back an empty buffer.
 */
public final class ScanException extends QuarryException {
	public ScanException(String description, Coordinate coordinate) {
		super(description, coordinate);
	}

	@Override
	public FaultKind kind() {
		return FaultKind.SCAN;
	}
}
