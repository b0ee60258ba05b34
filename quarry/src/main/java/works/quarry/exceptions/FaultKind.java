package works.quarry.exceptions;

/**
 * Identifies the pipeline stage that detected a fault.
 */
public enum FaultKind {
	DECODE,
	SCAN,
	LEXICAL,
	SYNTAX,
}
