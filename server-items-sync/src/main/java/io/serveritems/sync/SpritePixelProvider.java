package io.serveritems.sync;

/**
 * Source of compressed sprite pixels, keyed by sprite id.
 *
 * <p>Compressed pixels are a sequence of chunks: {@code u16 transparentCount, u16 coloredCount}, then
 * {@code coloredCount} pixels of RGB (or RGBA when the sprite file uses transparency), little endian counts.
 */
@FunctionalInterface
public interface SpritePixelProvider {

    /**
     * Returns the compressed pixels of {@code spriteId}, or null if the sprite does not exist.
     */
    byte[] compressedPixels(int spriteId);
}
