package io.serveritems.otb;

import io.serveritems.core.ServerItem;
import io.serveritems.core.ServerItemList;
import io.serveritems.core.ServerItemType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Serializes a {@link ServerItemList} to OTB.
 *
 * <p>Output is deterministic: items are written in ascending id order and properties in a fixed order.
 * Deprecated items carry only their server id.
 */
public final class OtbWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(OtbWriter.class);

    private OtbWriter() {
    }

    public static byte[] write(ServerItemList items) {
        Objects.requireNonNull(items, "items");
        BinaryTreeWriter out = new BinaryTreeWriter().writeHeader();

        out.startNode(OtbFormat.ROOT_NODE_TYPE);
        out.writeU32(0);
        out.writeProperty(OtbFormat.ROOT_ATTR_VERSION, versionData(items));

        int count = 0;
        for (ServerItem item : items.toArray()) {
            writeItem(out, item);
            count++;
        }
        out.endNode();

        byte[] bytes = out.toByteArray();
        LOGGER.debug("Wrote OTB {}.{}.{} with {} items ({} bytes)",
                items.majorVersion(), items.minorVersion(), items.buildNumber(), count, bytes.length);
        return bytes;
    }

    /**
     * CSD string stored in the version header, e.g. {@code "OTB 3.57.62-10.98"}.
     */
    static String csdVersion(ServerItemList items) {
        int cv = items.clientVersion();
        return "OTB " + Integer.toUnsignedString(items.majorVersion())
                + "." + Integer.toUnsignedString(items.minorVersion())
                + "." + Integer.toUnsignedString(items.buildNumber())
                + "-" + (cv / 100) + "." + (cv % 100);
    }

    private static byte[] versionData(ServerItemList items) {
        byte[] data = new byte[OtbFormat.VERSION_DATA_LENGTH];
        putU32(data, 0, items.majorVersion());
        putU32(data, 4, items.minorVersion());
        putU32(data, 8, items.buildNumber());
        byte[] csd = csdVersion(items).getBytes(StandardCharsets.UTF_8);
        System.arraycopy(csd, 0, data, 12, Math.min(csd.length, OtbFormat.CSD_LENGTH));
        return data;
    }

    private static void writeItem(BinaryTreeWriter out, ServerItem item) {
        out.startNode(item.type().group().code());
        out.writeU32(item.flags() & 0xFFFFFFFFL);

        out.writeProperty(OtbAttribute.SERVER_ID.code(), u16(item.id(), "server id"));

        if (item.type() != ServerItemType.DEPRECATED) {
            out.writeProperty(OtbAttribute.CLIENT_ID.code(), u16(item.clientId(), "client id"));

            byte[] hash = item.spriteHash();
            if (hash != null && hash.length > 0) {
                out.writeProperty(OtbAttribute.SPRITE_HASH.code(), hash);
            }
            if (item.minimapColor() != 0) {
                out.writeProperty(OtbAttribute.MINIMAP_COLOR.code(), u16(item.minimapColor(), "minimap color"));
            }
            if (item.maxReadWriteChars() != 0) {
                out.writeProperty(OtbAttribute.MAX_READ_WRITE_CHARS.code(), u16(item.maxReadWriteChars(), "max read/write chars"));
            }
            if (item.maxReadChars() != 0) {
                out.writeProperty(OtbAttribute.MAX_READ_CHARS.code(), u16(item.maxReadChars(), "max read chars"));
            }
            if (item.lightLevel() != 0 || item.lightColor() != 0) {
                byte[] light = new byte[4];
                putU16(light, 0, checkU16(item.lightLevel(), "light level"));
                putU16(light, 2, checkU16(item.lightColor(), "light color"));
                out.writeProperty(OtbAttribute.LIGHT.code(), light);
            }
            if (item.type() == ServerItemType.GROUND) {
                out.writeProperty(OtbAttribute.GROUND_SPEED.code(), u16(item.groundSpeed(), "ground speed"));
            }
            if (item.stackOrder().code() != 0) {
                out.writeProperty(OtbAttribute.STACK_ORDER.code(), new byte[] {(byte) item.stackOrder().code()});
            }
            if (item.tradeAs() != 0) {
                out.writeProperty(OtbAttribute.TRADE_AS.code(), u16(item.tradeAs(), "trade as"));
            }
            if (!item.name().isEmpty()) {
                out.writeProperty(OtbAttribute.NAME.code(), item.name().getBytes(StandardCharsets.UTF_8));
            }
        }

        out.endNode();
    }

    private static byte[] u16(int value, String field) {
        byte[] data = new byte[2];
        putU16(data, 0, checkU16(value, field));
        return data;
    }

    private static int checkU16(int value, String field) {
        if (value < 0 || value > 0xFFFF) {
            throw new IllegalArgumentException(field + " out of u16 range: " + value);
        }
        return value;
    }

    private static void putU16(byte[] data, int offset, int value) {
        data[offset] = (byte) value;
        data[offset + 1] = (byte) (value >>> 8);
    }

    private static void putU32(byte[] data, int offset, int value) {
        data[offset] = (byte) value;
        data[offset + 1] = (byte) (value >>> 8);
        data[offset + 2] = (byte) (value >>> 16);
        data[offset + 3] = (byte) (value >>> 24);
    }
}
