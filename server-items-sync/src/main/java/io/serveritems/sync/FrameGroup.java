package io.serveritems.sync;

import java.util.Objects;

/**
 * Sprite layout of one animation group of a thing.
 *
 * @param spriteIndex sprite ids, frame-major; the first {@code width * height * layers} entries form frame 0
 */
public record FrameGroup(
        FrameGroupType type,
        int width,
        int height,
        int layers,
        int patternX,
        int patternY,
        int patternZ,
        int frames,
        int[] spriteIndex) {

    public FrameGroup {
        Objects.requireNonNull(type, "type");
        spriteIndex = spriteIndex == null ? new int[0] : spriteIndex.clone();
    }

    /**
     * Single-pattern default group.
     */
    public static FrameGroup of(int width, int height, int layers, int frames, int... spriteIndex) {
        return new FrameGroup(FrameGroupType.DEFAULT, width, height, layers, 1, 1, 1, frames, spriteIndex);
    }

    @Override
    public int[] spriteIndex() {
        return spriteIndex.clone();
    }

    int spriteIdAt(int i) {
        return spriteIndex[i];
    }

    int spriteCount() {
        return spriteIndex.length;
    }

    /**
     * Number of sprites making up one frame of one pattern.
     */
    public int spritesPerFrame() {
        return width * height * layers;
    }
}
