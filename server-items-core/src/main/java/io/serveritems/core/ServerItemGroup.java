package io.serveritems.core;

/**
 * Item group byte stored at the start of every OTB item node.
 */
public enum ServerItemGroup {
    NONE(0),
    GROUND(1),
    CONTAINER(2),
    WEAPON(3),
    AMMUNITION(4),
    ARMOR(5),
    CHANGES(6),
    TELEPORT(7),
    MAGIC_FIELD(8),
    WRITABLE(9),
    KEY(10),
    SPLASH(11),
    FLUID(12),
    DOOR(13),
    DEPRECATED(14);

    private static final ServerItemGroup[] BY_CODE = values();

    private final int code;

    ServerItemGroup(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Resolves a group byte. Unknown codes resolve to {@link #NONE}.
     */
    public static ServerItemGroup fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) return NONE;
        return BY_CODE[code];
    }

    /**
     * Server item type this group reads as. Groups without a dedicated type read as {@link ServerItemType#NONE}.
     */
    public ServerItemType itemType() {
        switch (this) {
            case GROUND:
                return ServerItemType.GROUND;
            case CONTAINER:
                return ServerItemType.CONTAINER;
            case SPLASH:
                return ServerItemType.SPLASH;
            case FLUID:
                return ServerItemType.FLUID;
            case DEPRECATED:
                return ServerItemType.DEPRECATED;
            default:
                return ServerItemType.NONE;
        }
    }
}
