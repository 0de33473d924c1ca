package io.serveritems.core;

/**
 * Server-side item type. Only these six types survive a round trip through the OTB item group byte.
 */
public enum ServerItemType {
    NONE(0),
    GROUND(1),
    CONTAINER(2),
    FLUID(3),
    SPLASH(4),
    DEPRECATED(5);

    private final int code;

    ServerItemType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Item group written to the OTB node header for this type.
     */
    public ServerItemGroup group() {
        switch (this) {
            case GROUND:
                return ServerItemGroup.GROUND;
            case CONTAINER:
                return ServerItemGroup.CONTAINER;
            case FLUID:
                return ServerItemGroup.FLUID;
            case SPLASH:
                return ServerItemGroup.SPLASH;
            case DEPRECATED:
                return ServerItemGroup.DEPRECATED;
            default:
                return ServerItemGroup.NONE;
        }
    }
}
