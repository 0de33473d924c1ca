package io.serveritems.otb;

import io.serveritems.core.ServerItemsException;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Parses an escaped OTB byte stream into a tree of {@link Node}s.
 *
 * <p>The whole buffer is parsed up front; a truncated node, a dangling escape byte or a missing
 * root node raise {@link ServerItemsException.MalformedNodeStream}. Bytes after the root terminator are ignored.
 * Nesting deeper than {@link #MAX_DEPTH} is rejected the same way.
 */
public final class BinaryTreeReader {

    /** Deepest node level accepted; the root is level 1 and OTB items are level 2. */
    public static final int MAX_DEPTH = 16;

    /**
     * One node: its unescaped payload (starting with the node type byte) and its child nodes.
     */
    public static final class Node {
        private final byte[] data;
        private final List<Node> children;

        Node(byte[] data, List<Node> children) {
            this.data = data;
            this.children = Collections.unmodifiableList(children);
        }

        public int type() {
            return data.length == 0 ? -1 : data[0] & 0xFF;
        }

        /**
         * Unescaped payload including the leading type byte.
         */
        public byte[] data() {
            return data.clone();
        }

        public List<Node> children() {
            return children;
        }

        ByteCursor cursor(String context) {
            return new ByteCursor(data, context);
        }
    }

    private final byte[] buffer;
    private int position;

    private BinaryTreeReader(byte[] buffer) {
        this.buffer = buffer;
    }

    /**
     * Parses the root node of {@code buffer}.
     */
    public static Node readRoot(byte[] buffer) {
        Objects.requireNonNull(buffer, "buffer");
        if (buffer.length <= OtbFormat.HEADER_LENGTH || (buffer[OtbFormat.HEADER_LENGTH] & 0xFF) != OtbFormat.NODE_START) {
            throw new ServerItemsException.MalformedNodeStream("OTB: missing root node");
        }
        BinaryTreeReader reader = new BinaryTreeReader(buffer);
        reader.position = OtbFormat.HEADER_LENGTH + 1;
        return reader.readNode(1);
    }

    // position is just past the NODE_START byte
    private Node readNode(int depth) {
        ByteArrayOutputStream payload = new ByteArrayOutputStream();
        List<Node> children = new ArrayList<>();
        while (position < buffer.length) {
            int b = buffer[position++] & 0xFF;
            if (b == OtbFormat.NODE_END) {
                if (payload.size() == 0) {
                    throw new ServerItemsException.MalformedNodeStream(
                            "OTB: node without type byte ending at offset " + (position - 1));
                }
                return new Node(payload.toByteArray(), children);
            } else if (b == OtbFormat.NODE_START) {
                if (payload.size() == 0) {
                    throw new ServerItemsException.MalformedNodeStream(
                            "OTB: child node before type byte at offset " + (position - 1));
                }
                if (depth >= MAX_DEPTH) {
                    throw new ServerItemsException.MalformedNodeStream(
                            "OTB: nodes nested deeper than " + MAX_DEPTH + " at offset " + (position - 1));
                }
                children.add(readNode(depth + 1));
            } else if (b == OtbFormat.ESCAPE) {
                if (position >= buffer.length) {
                    throw new ServerItemsException.MalformedNodeStream("OTB: escape byte at end of stream");
                }
                payload.write(buffer[position++]);
            } else {
                payload.write(b);
            }
        }
        throw new ServerItemsException.MalformedNodeStream("OTB: truncated node, stream ended at offset " + position);
    }
}
