package io.serveritems.otb;

import java.io.ByteArrayOutputStream;

/**
 * Builds an escaped OTB byte stream.
 *
 * <p>Node markers are written raw; every payload byte equal to a marker or the escape byte is prefixed with
 * {@link OtbFormat#ESCAPE}.
 */
final class BinaryTreeWriter {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    BinaryTreeWriter writeHeader() {
        for (int i = 0; i < OtbFormat.HEADER_LENGTH; i++) {
            out.write(0);
        }
        return this;
    }

    BinaryTreeWriter startNode(int type) {
        out.write(OtbFormat.NODE_START);
        writeByte(type);
        return this;
    }

    BinaryTreeWriter endNode() {
        out.write(OtbFormat.NODE_END);
        return this;
    }

    BinaryTreeWriter writeByte(int value) {
        int b = value & 0xFF;
        if (OtbFormat.isSpecial(b)) {
            out.write(OtbFormat.ESCAPE);
        }
        out.write(b);
        return this;
    }

    BinaryTreeWriter writeU16(int value) {
        writeByte(value);
        writeByte(value >>> 8);
        return this;
    }

    BinaryTreeWriter writeU32(long value) {
        writeByte((int) value);
        writeByte((int) (value >>> 8));
        writeByte((int) (value >>> 16));
        writeByte((int) (value >>> 24));
        return this;
    }

    BinaryTreeWriter writeBytes(byte[] data) {
        for (byte b : data) {
            writeByte(b);
        }
        return this;
    }

    /**
     * Writes one TLV property: id byte, u16 length, data.
     */
    BinaryTreeWriter writeProperty(int id, byte[] data) {
        if (data.length > 0xFFFF) {
            throw new IllegalArgumentException("property 0x" + Integer.toHexString(id) + " too long: " + data.length);
        }
        writeByte(id);
        writeU16(data.length);
        writeBytes(data);
        return this;
    }

    byte[] toByteArray() {
        return out.toByteArray();
    }
}
