package io.serveritems.otb;

/**
 * Item node property ids.
 */
public enum OtbAttribute {
    SERVER_ID(0x10),
    CLIENT_ID(0x11),
    NAME(0x12),
    GROUND_SPEED(0x14),
    SPRITE_HASH(0x20),
    MINIMAP_COLOR(0x21),
    MAX_READ_WRITE_CHARS(0x22),
    MAX_READ_CHARS(0x23),
    LIGHT(0x2A),
    STACK_ORDER(0x2B),
    TRADE_AS(0x2D);

    private final int code;

    OtbAttribute(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Returns the attribute for {@code code}, or null for ids this codec does not know.
     */
    public static OtbAttribute fromCode(int code) {
        for (OtbAttribute a : values()) {
            if (a.code == code) return a;
        }
        return null;
    }
}
