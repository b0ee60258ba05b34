package works.quarry;

import works.quarry.decoder.Encoding;
import works.quarry.lexer.NumberConverter;
import works.quarry.lexer.NumberMode;
import works.quarry.parser.DuplicateKeys;

import static java.util.Objects.requireNonNull;

/**
 * @param encoding how bytes become characters
 * @param numberMode whether numbers are converted as they're lexed, or on first use
 * @param numberConverter turns number text into a {@link Number}
 * @param duplicateKeys what to do when an object repeats a member name
 * @param containerRoot if true, the document must be an object or array
 */
public record PipelineSettings(
	Encoding encoding,
	NumberMode numberMode,
	NumberConverter numberConverter,
	DuplicateKeys duplicateKeys,
	boolean containerRoot
) {
	public static final PipelineSettings DEFAULT = new PipelineSettings(
		Encoding.UTF_8,
		NumberMode.EAGER,
		NumberConverter.DOUBLE,
		DuplicateKeys.LAST_WINS,
		false);

	public PipelineSettings {
		requireNonNull(encoding);
		requireNonNull(numberMode);
		requireNonNull(numberConverter);
		requireNonNull(duplicateKeys);
	}

	public PipelineSettings withEncoding(Encoding encoding) {
		return new PipelineSettings(encoding, numberMode, numberConverter, duplicateKeys, containerRoot);
	}

	public PipelineSettings withNumberMode(NumberMode numberMode) {
		return new PipelineSettings(encoding, numberMode, numberConverter, duplicateKeys, containerRoot);
	}

	public PipelineSettings withNumberConverter(NumberConverter numberConverter) {
		return new PipelineSettings(encoding, numberMode, numberConverter, duplicateKeys, containerRoot);
	}

	public PipelineSettings withDuplicateKeys(DuplicateKeys duplicateKeys) {
		return new PipelineSettings(encoding, numberMode, numberConverter, duplicateKeys, containerRoot);
	}

	public PipelineSettings withContainerRoot(boolean containerRoot) {
		return new PipelineSettings(encoding, numberMode, numberConverter, duplicateKeys, containerRoot);
	}
}
