package io.serveritems.otb;

import io.serveritems.core.ServerItem;
import io.serveritems.core.ServerItemList;
import io.serveritems.core.ServerItemType;
import io.serveritems.core.TileStackOrder;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OtbRoundTripTest {

    @Test
    void preservesEveryPersistedField() {
        ServerItemList list = newList();
        ServerItem ground = new ServerItem(100, 200);
        ground.setType(ServerItemType.GROUND);
        ground.setGroundSpeed(150);
        ground.setSpriteHash(hash(1));
        ground.setMinimapColor(129);
        ground.setFullGround(true);
        ground.setMovable(false);
        list.add(ground);

        ServerItem book = new ServerItem(101, 201);
        book.setSpriteHash(hash(2));
        book.setReadable(true);
        book.setMaxReadWriteChars(512);
        book.setMaxReadChars(256);
        book.setLightLevel(7);
        book.setLightColor(215);
        book.setStackOrder(TileStackOrder.TOP);
        book.setHasStackOrder(true);
        book.setTradeAs(3000);
        book.setName("ancient tomé");
        book.setForceUse(true);
        book.setHookEast(true);
        book.setAnimation(true);
        list.add(book);

        ServerItemList read = OtbReader.read(OtbWriter.write(list));

        assertThat(read.majorVersion()).isEqualTo(3);
        assertThat(read.minorVersion()).isEqualTo(62);
        assertThat(read.buildNumber()).isEqualTo(5);
        assertThat(read.clientVersion()).isEqualTo(1098);
        assertThat(read.size()).isEqualTo(2);
        assertSameItem(read.getById(100), ground);
        assertSameItem(read.getById(101), book);
    }

    @Test
    void writeIsDeterministic() {
        ServerItemList list = newList();
        for (int i = 0; i < 20; i++) {
            ServerItem item = new ServerItem(120 - i, 300 + i);
            item.setSpriteHash(hash(i));
            item.setName("item " + i);
            list.add(item);
        }

        assertThat(OtbWriter.write(list)).isEqualTo(OtbWriter.write(list));
    }

    @Test
    void specialBytesInPayloadAreEscaped() {
        ServerItemList list = newList();
        ServerItem item = new ServerItem(0xFEFF, 0xFDFE);
        byte[] hash = new byte[16];
        for (int i = 0; i < 16; i++) {
            hash[i] = (byte) (0xFD + i % 3);
        }
        item.setSpriteHash(hash);
        item.setMinimapColor(0xFFFD);
        list.add(item);

        ServerItem read = OtbReader.read(OtbWriter.write(list)).getById(0xFEFF);

        assertThat(read).isNotNull();
        assertThat(read.clientId()).isEqualTo(0xFDFE);
        assertThat(read.spriteHash()).isEqualTo(hash);
        assertThat(read.minimapColor()).isEqualTo(0xFFFD);
    }

    @Test
    void deprecatedItemsOnlyKeepServerId() {
        ServerItemList list = newList();
        ServerItem item = new ServerItem(100, 500);
        item.setType(ServerItemType.DEPRECATED);
        item.setName("gone");
        item.setSpriteHash(hash(9));
        list.add(item);

        ServerItem read = OtbReader.read(OtbWriter.write(list)).getById(100);

        assertThat(read.type()).isEqualTo(ServerItemType.DEPRECATED);
        assertThat(read.clientId()).isZero();
        assertThat(read.name()).isEmpty();
        assertThat(read.spriteHash()).isNull();
    }

    @Test
    void missingHashIsFilledWithZeros() {
        ServerItemList list = newList();
        list.add(new ServerItem(100, 200));

        ServerItem read = OtbReader.read(OtbWriter.write(list)).getById(100);

        assertThat(read.spriteHash()).isEqualTo(new byte[16]);
    }

    @Test
    void groundSpeedOnlyWrittenForGround() {
        ServerItemList list = newList();
        ServerItem item = new ServerItem(100, 200);
        item.setGroundSpeed(150);
        list.add(item);

        assertThat(OtbReader.read(OtbWriter.write(list)).getById(100).groundSpeed()).isZero();
    }

    @Test
    void stackOrderPropertySetsHasStackOrder() {
        ServerItemList list = newList();
        ServerItem item = new ServerItem(100, 200);
        item.setStackOrder(TileStackOrder.BORDER);
        list.add(item);

        ServerItem read = OtbReader.read(OtbWriter.write(list)).getById(100);

        assertThat(read.stackOrder()).isEqualTo(TileStackOrder.BORDER);
        assertThat(read.hasStackOrder()).isTrue();
    }

    @Test
    void csdStringEncodesVersions() {
        ServerItemList list = newList();

        assertThat(OtbWriter.csdVersion(list)).isEqualTo("OTB 3.62.5-10.98");
    }

    private static ServerItemList newList() {
        ServerItemList list = new ServerItemList();
        list.setMajorVersion(3);
        list.setMinorVersion(62);
        list.setBuildNumber(5);
        list.setClientVersion(1098);
        return list;
    }

    private static byte[] hash(int seed) {
        byte[] h = new byte[16];
        for (int i = 0; i < h.length; i++) {
            h[i] = (byte) (seed * 31 + i * 17);
        }
        return h;
    }

    private static void assertSameItem(ServerItem actual, ServerItem expected) {
        assertThat(actual).isNotNull();
        assertThat(actual.id()).isEqualTo(expected.id());
        assertThat(actual.clientId()).isEqualTo(expected.clientId());
        assertThat(actual.type()).isEqualTo(expected.type());
        assertThat(actual.flags()).isEqualTo(expected.flags());
        assertThat(actual.stackOrder()).isEqualTo(expected.stackOrder());
        assertThat(actual.hasStackOrder()).isEqualTo(expected.hasStackOrder());
        assertThat(actual.groundSpeed()).isEqualTo(expected.groundSpeed());
        assertThat(actual.lightLevel()).isEqualTo(expected.lightLevel());
        assertThat(actual.lightColor()).isEqualTo(expected.lightColor());
        assertThat(actual.maxReadChars()).isEqualTo(expected.maxReadChars());
        assertThat(actual.maxReadWriteChars()).isEqualTo(expected.maxReadWriteChars());
        assertThat(actual.minimapColor()).isEqualTo(expected.minimapColor());
        assertThat(actual.tradeAs()).isEqualTo(expected.tradeAs());
        assertThat(actual.name()).isEqualTo(expected.name());
        assertThat(actual.spriteHash()).isEqualTo(expected.spriteHash());
    }
}
