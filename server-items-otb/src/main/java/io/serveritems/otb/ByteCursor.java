package io.serveritems.otb;

import io.serveritems.core.ServerItemsException;

import java.util.Arrays;

/**
 * Little-endian reader over an unescaped node payload. Every read is bounds checked.
 */
final class ByteCursor {
    private final byte[] data;
    private final String context;
    private int position;

    ByteCursor(byte[] data, String context) {
        this.data = data;
        this.context = context;
    }

    int position() {
        return position;
    }

    int remaining() {
        return data.length - position;
    }

    boolean hasRemaining() {
        return position < data.length;
    }

    int u8() {
        require(1);
        return data[position++] & 0xFF;
    }

    int u16() {
        require(2);
        int v = (data[position] & 0xFF) | (data[position + 1] & 0xFF) << 8;
        position += 2;
        return v;
    }

    long u32() {
        require(4);
        long v = (data[position] & 0xFFL)
                | (data[position + 1] & 0xFFL) << 8
                | (data[position + 2] & 0xFFL) << 16
                | (data[position + 3] & 0xFFL) << 24;
        position += 4;
        return v;
    }

    byte[] bytes(int length) {
        require(length);
        byte[] out = Arrays.copyOfRange(data, position, position + length);
        position += length;
        return out;
    }

    void skip(int length) {
        require(length);
        position += length;
    }

    private void require(int n) {
        if (n < 0 || data.length - position < n) {
            throw new ServerItemsException.MalformedNodeStream(
                    "OTB: " + context + " truncated at offset " + position + " (need " + n + ", have " + remaining() + ")");
        }
    }
}
