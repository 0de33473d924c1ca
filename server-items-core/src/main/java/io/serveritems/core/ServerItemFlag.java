package io.serveritems.core;

/**
 * Bits of the 32-bit OTB item flags word.
 *
 * <p>All defined bits are named, including the ones {@link ServerItem} does not model
 * (floor change directions, can-not-decay, unused). Those are dropped on read.
 */
public enum ServerItemFlag {
    UNPASSABLE(0),
    BLOCK_MISSILES(1),
    BLOCK_PATHFINDER(2),
    HAS_ELEVATION(3),
    MULTI_USE(4),
    PICKUPABLE(5),
    MOVABLE(6),
    STACKABLE(7),
    FLOOR_CHANGE_DOWN(8),
    FLOOR_CHANGE_NORTH(9),
    FLOOR_CHANGE_EAST(10),
    FLOOR_CHANGE_SOUTH(11),
    FLOOR_CHANGE_WEST(12),
    STACK_ORDER(13),
    READABLE(14),
    ROTATABLE(15),
    HANGABLE(16),
    HOOK_EAST(17),
    HOOK_SOUTH(18),
    CAN_NOT_DECAY(19),
    ALLOW_DISTANCE_READ(20),
    UNUSED(21),
    CLIENT_CHARGES(22),
    IGNORE_LOOK(23),
    IS_ANIMATION(24),
    FULL_GROUND(25),
    FORCE_USE(26);

    private final int mask;

    ServerItemFlag(int bit) {
        this.mask = 1 << bit;
    }

    public int mask() {
        return mask;
    }

    public boolean isSet(int flags) {
        return (flags & mask) != 0;
    }
}
