package works.quarry.exceptions;

import works.quarry.text.Coordinate;

import static java.util.Objects.requireNonNull;

/**
 * Base class of every fault raised by the pipeline.
 * <p>
 * Faults are terminal: once one is thrown, the stage that threw it
 * (and every stage above it) produces nothing further.
 * No stage catches a lower stage's fault to recover from it;
 * each simply lets it through its own "produce next item" method.
 */
public sealed abstract class QuarryException extends RuntimeException permits
	DecodeException,
	ScanException,
	LexicalException,
	JsonSyntaxException
{
	private final String description;
	private final Coordinate coordinate;

	protected QuarryException(String description, Coordinate coordinate) {
		super(description + " at " + coordinate);
		this.description = description;
		this.coordinate = requireNonNull(coordinate);
	}

	protected QuarryException(String description, Coordinate coordinate, Throwable cause) {
		super(description + " at " + coordinate, cause);
		this.description = description;
		this.coordinate = requireNonNull(coordinate);
	}

	public abstract FaultKind kind();

	/**
	 * @return where the fault was detected
	 */
	public Coordinate coordinate() {
		return coordinate;
	}

	/**
	 * @return the message without the location
	 */
	public String description() {
		return description;
	}
}
