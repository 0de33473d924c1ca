package io.serveritems.otb;

import io.serveritems.core.ServerItem;
import io.serveritems.core.ServerItemGroup;
import io.serveritems.core.ServerItemList;
import io.serveritems.core.ServerItemsException;
import io.serveritems.core.TileStackOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads an OTB buffer into a new {@link ServerItemList}.
 *
 * <p>Structural errors abort the read and no list is returned. Unknown item properties are skipped by length.
 */
public final class OtbReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(OtbReader.class);

    private static final Pattern CSD_VERSION = Pattern.compile("^OTB \\d+\\.\\d+\\.\\d+-(\\d+)\\.(\\d+)");

    private OtbReader() {
    }

    public static ServerItemList read(byte[] buffer) {
        BinaryTreeReader.Node root = BinaryTreeReader.readRoot(buffer);
        ServerItemList items = new ServerItemList();

        readRootHeader(root, items);
        for (BinaryTreeReader.Node node : root.children()) {
            items.add(readItem(node));
        }

        LOGGER.debug("Read OTB {}.{}.{} (client {}) with {} items",
                items.majorVersion(), items.minorVersion(), items.buildNumber(), items.clientVersion(), items.size());
        return items;
    }

    private static void readRootHeader(BinaryTreeReader.Node root, ServerItemList items) {
        ByteCursor cursor = root.cursor("root node");
        cursor.u8(); // node type
        cursor.u32(); // flags, unused
        if (!cursor.hasRemaining()) return;

        int attribute = cursor.u8();
        if (attribute != OtbFormat.ROOT_ATTR_VERSION) return;

        int length = cursor.u16();
        if (length != OtbFormat.VERSION_DATA_LENGTH) {
            throw new ServerItemsException.InvalidVersionHeader(length);
        }
        items.setMajorVersion((int) cursor.u32());
        items.setMinorVersion((int) cursor.u32());
        items.setBuildNumber((int) cursor.u32());
        items.setClientVersion(parseClientVersion(cursor.bytes(OtbFormat.CSD_LENGTH)));
    }

    /**
     * Extracts {@code major * 100 + minor} from a CSD string such as {@code "OTB 3.57.62-10.98"}; 0 if absent.
     */
    static int parseClientVersion(byte[] csd) {
        int end = 0;
        while (end < csd.length && csd[end] != 0) end++;
        String text = new String(csd, 0, end, StandardCharsets.UTF_8);
        Matcher m = CSD_VERSION.matcher(text);
        if (!m.find()) return 0;
        try {
            return Integer.parseInt(m.group(1)) * 100 + Integer.parseInt(m.group(2));
        } catch (NumberFormatException e) {
            LOGGER.debug("Ignoring unparsable CSD version '{}'", text);
            return 0;
        }
    }

    private static ServerItem readItem(BinaryTreeReader.Node node) {
        ByteCursor cursor = node.cursor("item node");
        ServerItem item = new ServerItem();

        item.setType(ServerItemGroup.fromCode(cursor.u8()).itemType());
        item.applyFlags((int) cursor.u32());

        while (cursor.hasRemaining()) {
            int id = cursor.u8();
            int length = cursor.u16();
            byte[] data = cursor.bytes(length);
            OtbAttribute attribute = OtbAttribute.fromCode(id);
            if (attribute == null) {
                LOGGER.debug("Skipping unknown OTB attribute 0x{} ({} bytes)", Integer.toHexString(id), length);
                continue;
            }
            readProperty(item, attribute, new ByteCursor(data, attribute.name()));
        }

        if (item.spriteHash() == null && !item.isDeprecated()) {
            item.setSpriteHash(ServerItem.emptySpriteHash());
        }
        return item;
    }

    private static void readProperty(ServerItem item, OtbAttribute attribute, ByteCursor data) {
        switch (attribute) {
            case SERVER_ID:
                item.setId(data.u16());
                break;
            case CLIENT_ID:
                item.setClientId(data.u16());
                break;
            case NAME:
                item.setName(new String(data.bytes(data.remaining()), StandardCharsets.UTF_8));
                break;
            case GROUND_SPEED:
                item.setGroundSpeed(data.u16());
                break;
            case SPRITE_HASH:
                item.setSpriteHash(data.bytes(data.remaining()));
                break;
            case MINIMAP_COLOR:
                item.setMinimapColor(data.u16());
                break;
            case MAX_READ_WRITE_CHARS:
                item.setMaxReadWriteChars(data.u16());
                break;
            case MAX_READ_CHARS:
                item.setMaxReadChars(data.u16());
                break;
            case LIGHT:
                item.setLightLevel(data.u16());
                item.setLightColor(data.u16());
                break;
            case STACK_ORDER:
                item.setStackOrder(TileStackOrder.fromCode(data.u8()));
                item.setHasStackOrder(true);
                break;
            case TRADE_AS:
                item.setTradeAs(data.u16());
                break;
            default:
                break;
        }
    }
}
