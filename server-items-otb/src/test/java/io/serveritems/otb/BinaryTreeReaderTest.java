package io.serveritems.otb;

import io.serveritems.core.ServerItemsException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BinaryTreeReaderTest {

    @Test
    void unescapesPayloadAndCollectsChildren() {
        byte[] stream = new BinaryTreeWriter().writeHeader()
                .startNode(0).writeBytes(new byte[] {(byte) 0xFD, (byte) 0xFE, (byte) 0xFF, 0x01})
                .startNode(7).writeU16(0xFFFE).endNode()
                .startNode(8).endNode()
                .endNode()
                .toByteArray();

        BinaryTreeReader.Node root = BinaryTreeReader.readRoot(stream);

        assertThat(root.type()).isZero();
        assertThat(root.data()).containsExactly(0, (byte) 0xFD, (byte) 0xFE, (byte) 0xFF, 0x01);
        assertThat(root.children()).hasSize(2);
        assertThat(root.children().get(0).data()).containsExactly(7, (byte) 0xFE, (byte) 0xFF);
        assertThat(root.children().get(1).type()).isEqualTo(8);
    }

    @Test
    void danglingEscapeIsFatal() {
        byte[] stream = {0, 0, 0, 0, (byte) 0xFE, 0, (byte) 0xFD};

        assertThatThrownBy(() -> BinaryTreeReader.readRoot(stream))
                .isInstanceOf(ServerItemsException.MalformedNodeStream.class)
                .hasMessageContaining("escape");
    }

    @Test
    void unterminatedChildIsFatal() {
        byte[] stream = {0, 0, 0, 0, (byte) 0xFE, 0, (byte) 0xFE, 1, 2, 3};

        assertThatThrownBy(() -> BinaryTreeReader.readRoot(stream))
                .isInstanceOf(ServerItemsException.MalformedNodeStream.class);
    }

    @Test
    void ignoresTrailingBytes() {
        byte[] stream = {0, 0, 0, 0, (byte) 0xFE, 0, 1, (byte) 0xFF, 0x55, 0x66};

        assertThat(BinaryTreeReader.readRoot(stream).data()).containsExactly(0, 1);
    }

    @Test
    void deeplyNestedNodesAreFatal() {
        byte[] stream = new byte[4 + 200_000 * 2];
        for (int i = 4; i < stream.length; i += 2) {
            stream[i] = (byte) 0xFE;
        }

        assertThatThrownBy(() -> OtbReader.read(stream))
                .isInstanceOf(ServerItemsException.MalformedNodeStream.class)
                .hasMessageContaining("nested deeper");
    }

    @Test
    void acceptsNestingUpToTheLimit() {
        BinaryTreeWriter writer = new BinaryTreeWriter().writeHeader();
        for (int depth = 0; depth < BinaryTreeReader.MAX_DEPTH; depth++) {
            writer.startNode(depth);
        }
        for (int depth = 0; depth < BinaryTreeReader.MAX_DEPTH; depth++) {
            writer.endNode();
        }

        BinaryTreeReader.Node node = BinaryTreeReader.readRoot(writer.toByteArray());
        for (int depth = 1; depth < BinaryTreeReader.MAX_DEPTH; depth++) {
            node = node.children().get(0);
        }
        assertThat(node.type()).isEqualTo(BinaryTreeReader.MAX_DEPTH - 1);
        assertThat(node.children()).isEmpty();
    }
}
