package io.serveritems.otb;

/**
 * Constants of the OTB container.
 */
public final class OtbFormat {
    private OtbFormat() {
    }

    public static final int NODE_START = 0xFE;
    public static final int NODE_END = 0xFF;
    public static final int ESCAPE = 0xFD;

    /** Unescaped bytes preceding the root node. */
    public static final int HEADER_LENGTH = 4;

    public static final int ROOT_NODE_TYPE = 0;
    public static final int ROOT_ATTR_VERSION = 0x01;

    /** major(4) + minor(4) + build(4) + CSD string(128). */
    public static final int VERSION_DATA_LENGTH = 140;
    public static final int CSD_LENGTH = 128;

    public static boolean isSpecial(int b) {
        return b == NODE_START || b == NODE_END || b == ESCAPE;
    }
}
