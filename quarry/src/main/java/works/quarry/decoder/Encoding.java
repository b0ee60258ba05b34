package works.quarry.decoder;

/**
 * The byte encodings the pipeline understands.
 */
public enum Encoding {
	UTF_8,

	/**
	 * Strict 7-bit ASCII. Bytes 0x80 and above are rejected.
	 */
	ASCII,
}
