package io.serveritems.otb;

import io.serveritems.core.ServerItem;
import io.serveritems.core.ServerItemList;
import io.serveritems.core.ServerItemsException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OtbReaderTest {

    @Test
    void rejectsWrongVersionHeaderLength() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(new byte[] {0, 0, 0, 0, (byte) 0xFE, 0, 0, 0, 0, 0});
        out.write(0x01);
        out.write(139);
        out.write(0);
        out.writeBytes(new byte[139]);
        out.write(0xFF);

        assertThatThrownBy(() -> OtbReader.read(out.toByteArray()))
                .isInstanceOf(ServerItemsException.InvalidVersionHeader.class)
                .hasMessageContaining("139");
    }

    @Test
    void rejectsMissingRoot() {
        assertThatThrownBy(() -> OtbReader.read(new byte[] {0, 0, 0, 0}))
                .isInstanceOf(ServerItemsException.MalformedNodeStream.class);
        assertThatThrownBy(() -> OtbReader.read(new byte[] {0, 0, 0, 0, 0x01}))
                .isInstanceOf(ServerItemsException.MalformedNodeStream.class);
    }

    @Test
    void rejectsTruncatedStream() {
        byte[] full = OtbWriter.write(listWithOneItem());
        byte[] truncated = Arrays.copyOf(full, full.length - 3);

        assertThatThrownBy(() -> OtbReader.read(truncated))
                .isInstanceOf(ServerItemsException.MalformedNodeStream.class);
    }

    @Test
    void rejectsPropertyLongerThanNode() {
        byte[] bytes = {0, 0, 0, 0, (byte) 0xFE, 0, 0, 0, 0, 0,
                (byte) 0xFE, 0, 0, 0, 0, 0, 0x10, 0x08, 0x00, 0x64, 0x00, (byte) 0xFF,
                (byte) 0xFF};

        assertThatThrownBy(() -> OtbReader.read(bytes))
                .isInstanceOf(ServerItemsException.MalformedNodeStream.class);
    }

    @Test
    void skipsUnknownAttributes() {
        byte[] bytes = {0, 0, 0, 0, (byte) 0xFE, 0, 0, 0, 0, 0,
                (byte) 0xFE, 0x01, 0, 0, 0, 0,
                0x10, 0x02, 0x00, 0x64, 0x00,
                0x7A, 0x03, 0x00, 0x01, 0x02, 0x03,
                0x11, 0x02, 0x00, (byte) 0xC8, 0x00,
                (byte) 0xFF,
                (byte) 0xFF};

        ServerItemList list = OtbReader.read(bytes);

        ServerItem item = list.getById(100);
        assertThat(item).isNotNull();
        assertThat(item.clientId()).isEqualTo(200);
        assertThat(list.majorVersion()).isZero();
    }

    @Test
    void parsesClientVersionFromCsdString() {
        byte[] csd = new byte[128];
        byte[] text = "OTB 3.57.62-8.60".getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(text, 0, csd, 0, text.length);

        assertThat(OtbReader.parseClientVersion(csd)).isEqualTo(860);
        assertThat(OtbReader.parseClientVersion(new byte[128])).isZero();
    }

    @Test
    void readsEmptyDatabase() {
        ServerItemList empty = new ServerItemList();

        ServerItemList read = OtbReader.read(OtbWriter.write(empty));

        assertThat(read.size()).isZero();
        assertThat(read.maxId()).isEqualTo(100);
    }

    private static ServerItemList listWithOneItem() {
        ServerItemList list = new ServerItemList();
        ServerItem item = new ServerItem(100, 200);
        item.setName("torch");
        list.add(item);
        return list;
    }
}
