/**
 * A layered JSON pipeline: bytes are {@link works.quarry.decoder decoded} into characters,
 * {@link works.quarry.scanner scanned} with coordinates, {@link works.quarry.lexer lexed} into tokens,
 * and {@link works.quarry.parser parsed} either into a {@link works.quarry.tree tree}
 * or into a stream of events.
 * <p>
 * {@link works.quarry.Pipeline} puts the stages together.
 */
package works.quarry;
