package io.serveritems.core;

public enum TileStackOrder {
    NONE(0),
    BORDER(1),
    BOTTOM(2),
    TOP(3);

    private final int code;

    TileStackOrder(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Resolves a stack order byte. Out-of-range values resolve to {@link #NONE}.
     */
    public static TileStackOrder fromCode(int code) {
        for (TileStackOrder order : values()) {
            if (order.code == code) return order;
        }
        return NONE;
    }
}
