package io.serveritems.sync;

import io.serveritems.core.ContentHash;
import io.serveritems.core.ServerItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Objects;

/**
 * Sprite fingerprint stored in the OTB SPRITE_HASH attribute.
 *
 * <p>The hash is the MD5 of the first {@code width * height * layers} sprites of the default frame group,
 * each decoded to 32x32 RGB, flipped vertically and emitted as BGR0.
 */
public final class SpriteHash {
    private static final Logger LOGGER = LoggerFactory.getLogger(SpriteHash.class);

    /** Fill value for transparent pixels in decoded RGB data. */
    public static final int TRANSPARENT_COLOR = 0x11;
    public static final int SPRITE_SIZE = 32;
    public static final int RGB_LENGTH = SPRITE_SIZE * SPRITE_SIZE * 3;

    private static final int PIXELS = SPRITE_SIZE * SPRITE_SIZE;

    private SpriteHash() {
    }

    /**
     * Computes the sprite hash of a thing. Returns 16 zero bytes when the thing has no default
     * frame group or its sprite index is shorter than one frame.
     */
    public static byte[] compute(ThingType thing, SpritePixelProvider provider, boolean transparent) {
        Objects.requireNonNull(thing, "thing");
        Objects.requireNonNull(provider, "provider");
        FrameGroup group = thing.defaultFrameGroup();
        if (group == null) {
            LOGGER.debug("Thing {} has no default frame group, using empty sprite hash", thing.id());
            return ServerItem.emptySpriteHash();
        }
        int count = group.spritesPerFrame();
        if (count < 0 || group.spriteCount() < count) {
            LOGGER.debug("Thing {} lists {} of {} sprites, using empty sprite hash", thing.id(), group.spriteCount(), count);
            return ServerItem.emptySpriteHash();
        }

        MessageDigest md5 = ContentHash.newMd5();
        byte[] bgr0 = new byte[PIXELS * 4];
        for (int i = 0; i < count; i++) {
            int spriteId = group.spriteIdAt(i);
            byte[] compressed = spriteId > 0 ? provider.compressedPixels(spriteId) : null;
            if (compressed == null || compressed.length == 0) {
                fillTransparent(bgr0);
            } else {
                toFlippedBgr0(rgbData(compressed, transparent), bgr0);
            }
            md5.update(bgr0);
        }
        return md5.digest();
    }

    /**
     * Decodes run-length compressed sprite pixels into 32x32 RGB, using {@link #TRANSPARENT_COLOR}
     * for transparent runs and for any pixels the data does not cover.
     *
     * <p>Each chunk is a little-endian u16 transparent count, a u16 colored count and that many
     * RGB pixels (RGBA when {@code transparent}). A truncated chunk header ends decoding, missing
     * color bytes read as zero and pixels past the sprite are dropped.
     */
    public static byte[] rgbData(byte[] compressed, boolean transparent) {
        byte[] rgb = new byte[RGB_LENGTH];
        Arrays.fill(rgb, (byte) TRANSPARENT_COLOR);
        if (compressed == null) return rgb;

        int read = 0;
        int write = 0;
        int bytesPerPixel = transparent ? 4 : 3;
        while (read + 4 <= compressed.length) {
            int transparentPixels = u16(compressed, read);
            int coloredPixels = u16(compressed, read + 2);
            read += 4;

            write += transparentPixels * 3;
            for (int i = 0; i < coloredPixels; i++) {
                for (int c = 0; c < 3; c++) {
                    byte value = read + c < compressed.length ? compressed[read + c] : 0;
                    if (write >= 0 && write < RGB_LENGTH) rgb[write] = value;
                    write++;
                }
                read += bytesPerPixel;
            }
            if (write >= RGB_LENGTH) break;
        }
        return rgb;
    }

    private static int u16(byte[] data, int offset) {
        return (data[offset] & 0xFF) | (data[offset + 1] & 0xFF) << 8;
    }

    private static void fillTransparent(byte[] bgr0) {
        for (int p = 0; p < bgr0.length; p += 4) {
            bgr0[p] = TRANSPARENT_COLOR;
            bgr0[p + 1] = TRANSPARENT_COLOR;
            bgr0[p + 2] = TRANSPARENT_COLOR;
            bgr0[p + 3] = 0;
        }
    }

    private static void toFlippedBgr0(byte[] rgb, byte[] bgr0) {
        int out = 0;
        for (int y = 0; y < SPRITE_SIZE; y++) {
            int row = (SPRITE_SIZE - y - 1) * SPRITE_SIZE * 3;
            for (int x = 0; x < SPRITE_SIZE; x++) {
                int src = row + x * 3;
                bgr0[out++] = rgb[src + 2];
                bgr0[out++] = rgb[src + 1];
                bgr0[out++] = rgb[src];
                bgr0[out++] = 0;
            }
        }
    }
}
