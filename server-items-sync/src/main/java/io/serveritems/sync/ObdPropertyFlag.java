package io.serveritems.sync;

import io.serveritems.core.ServerItemsException;

/**
 * Property flag bytes of the OBD thing-type format. These codes are fixed across client versions,
 * unlike the per-era DAT flag tables.
 *
 * <p>{@link #LAST_FLAG} terminates a property list.
 */
public enum ObdPropertyFlag {
    GROUND(0x00),
    GROUND_BORDER(0x01),
    ON_BOTTOM(0x02),
    ON_TOP(0x03),
    CONTAINER(0x04),
    STACKABLE(0x05),
    FORCE_USE(0x06),
    MULTI_USE(0x07),
    WRITABLE(0x08),
    WRITABLE_ONCE(0x09),
    FLUID_CONTAINER(0x0A),
    FLUID(0x0B),
    UNPASSABLE(0x0C),
    UNMOVEABLE(0x0D),
    BLOCK_MISSILE(0x0E),
    BLOCK_PATHFIND(0x0F),
    NO_MOVE_ANIMATION(0x10),
    PICKUPABLE(0x11),
    HANGABLE(0x12),
    HOOK_SOUTH(0x13),
    HOOK_EAST(0x14),
    ROTATABLE(0x15),
    HAS_LIGHT(0x16),
    DONT_HIDE(0x17),
    TRANSLUCENT(0x18),
    HAS_OFFSET(0x19),
    HAS_ELEVATION(0x1A),
    LYING_OBJECT(0x1B),
    ANIMATE_ALWAYS(0x1C),
    MINI_MAP(0x1D),
    LENS_HELP(0x1E),
    FULL_GROUND(0x1F),
    IGNORE_LOOK(0x20),
    CLOTH(0x21),
    MARKET_ITEM(0x22),
    DEFAULT_ACTION(0x23),
    WRAPPABLE(0x24),
    UNWRAPPABLE(0x25),
    TOP_EFFECT(0x26),
    HAS_CHARGES(0xFC),
    FLOOR_CHANGE(0xFD),
    USABLE(0xFE),
    LAST_FLAG(0xFF);

    private static final ObdPropertyFlag[] BY_CODE = new ObdPropertyFlag[256];

    static {
        for (ObdPropertyFlag flag : values()) {
            BY_CODE[flag.code] = flag;
        }
    }

    private final int code;

    ObdPropertyFlag(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @throws ServerItemsException.UnknownPropertyFlag if {@code code} is not a defined flag byte
     */
    public static ObdPropertyFlag fromCode(int code) {
        ObdPropertyFlag flag = code >= 0 && code < BY_CODE.length ? BY_CODE[code] : null;
        if (flag == null) {
            throw new ServerItemsException.UnknownPropertyFlag(code);
        }
        return flag;
    }
}
