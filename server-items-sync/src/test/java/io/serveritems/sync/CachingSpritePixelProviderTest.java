package io.serveritems.sync;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CachingSpritePixelProviderTest {

    @Test
    void servesRepeatedLookupsFromCache() {
        AtomicInteger calls = new AtomicInteger();
        CachingSpritePixelProvider provider = new CachingSpritePixelProvider(id -> {
            calls.incrementAndGet();
            return new byte[] {(byte) id};
        }, 2);

        byte[] first = provider.compressedPixels(5);
        assertThat(provider.compressedPixels(5)).isSameAs(first);
        assertThat(calls).hasValue(1);
    }

    @Test
    void evictsLeastRecentlyUsed() {
        AtomicInteger calls = new AtomicInteger();
        CachingSpritePixelProvider provider = new CachingSpritePixelProvider(id -> {
            calls.incrementAndGet();
            return new byte[] {(byte) id};
        }, 2);

        provider.compressedPixels(1);
        provider.compressedPixels(2);
        provider.compressedPixels(1);
        provider.compressedPixels(3);
        assertThat(provider.cachedCount()).isEqualTo(2);

        provider.compressedPixels(1);
        assertThat(calls).hasValue(3);
        provider.compressedPixels(2);
        assertThat(calls).hasValue(4);
    }

    @Test
    void doesNotCacheMissingSprites() {
        AtomicInteger calls = new AtomicInteger();
        CachingSpritePixelProvider provider = new CachingSpritePixelProvider(id -> {
            calls.incrementAndGet();
            return null;
        }, 4);

        assertThat(provider.compressedPixels(9)).isNull();
        assertThat(provider.compressedPixels(9)).isNull();
        assertThat(calls).hasValue(2);
        assertThat(provider.cachedCount()).isZero();
    }
}
