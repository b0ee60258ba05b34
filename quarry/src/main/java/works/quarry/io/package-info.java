/**
 * Byte sources for the pipeline.
 * A {@link works.quarry.io.ChunkFiller} hands out {@link works.quarry.io.ByteChunk}s one at a time;
 * the {@link works.quarry.decoder decoders} turn them into characters.
 */
package works.quarry.io;
