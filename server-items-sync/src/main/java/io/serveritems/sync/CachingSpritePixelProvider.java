package io.serveritems.sync;

import io.serveritems.core.LruCache;

import java.util.Objects;

/**
 * Memoizes compressed sprite pixels from a slower provider, such as an SPR file reader.
 * Missing sprites are not cached.
 */
public final class CachingSpritePixelProvider implements SpritePixelProvider {
    private final SpritePixelProvider delegate;
    private final LruCache<Integer, byte[]> cache;

    public CachingSpritePixelProvider(SpritePixelProvider delegate, int maxSize) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.cache = new LruCache<>(maxSize);
    }

    @Override
    public byte[] compressedPixels(int spriteId) {
        byte[] cached = cache.get(spriteId);
        if (cached != null) return cached;
        byte[] pixels = delegate.compressedPixels(spriteId);
        if (pixels != null) {
            cache.set(spriteId, pixels);
        }
        return pixels;
    }

    public int cachedCount() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
    }
}
