package io.serveritems.sync;

import io.serveritems.core.ServerItem;
import io.serveritems.core.ServerItemType;
import io.serveritems.core.TileStackOrder;

import java.util.Objects;

/**
 * Projects client thing types onto server items and detects drift between the two.
 *
 * <p>Everything here is a pure function of its inputs; the only mutation is on the item passed to
 * {@link #syncFromThingType}.
 */
public final class OtbSync {

    /** First client version whose OTB files carry forceUse and fullGround. */
    public static final int FORCE_USE_MIN_VERSION = 1010;

    /** Lens help value that marks a thing as readable. */
    public static final int READABLE_LENS_HELP = 1112;

    private OtbSync() {
    }

    public static void syncFromThingType(ServerItem item, ThingType thing) {
        syncFromThingType(item, thing, SyncOptions.defaults());
    }

    public static void syncFromThingType(ServerItem item, ThingType thing, boolean syncType, int clientVersion) {
        syncFromThingType(item, thing, SyncOptions.builder()
                .syncType(syncType)
                .clientVersion(clientVersion)
                .build());
    }

    /**
     * Overwrites the item's flags and attributes with the values derived from {@code thing}.
     *
     * <p>The type is only replaced when {@link SyncOptions#syncType()} is set. The sprite hash is only
     * recomputed when a pixel provider is given and the item is not deprecated. An empty market name
     * and a zero trade-as id leave the item's name and tradeAs untouched.
     */
    public static void syncFromThingType(ServerItem item, ThingType thing, SyncOptions options) {
        Objects.requireNonNull(item, "item");
        Objects.requireNonNull(thing, "thing");
        Objects.requireNonNull(options, "options");

        if (options.syncType()) {
            item.setType(expectedType(thing));
        }

        SpritePixelProvider provider = options.pixelProvider();
        if (provider != null && item.type() != ServerItemType.DEPRECATED) {
            item.setSpriteHash(SpriteHash.compute(thing, provider, options.transparent()));
            item.setSpriteAssigned(true);
        }

        item.setUnpassable(thing.isUnpassable());
        item.setBlockMissiles(thing.blockMissile());
        item.setBlockPathfinder(thing.blockPathfind());
        item.setHasElevation(thing.hasElevation());
        item.setMultiUse(thing.multiUse());
        item.setPickupable(thing.pickupable());
        item.setMovable(!thing.isUnmoveable());
        item.setStackable(thing.stackable());
        item.setReadable(expectedReadable(thing));
        item.setRotatable(thing.rotatable());
        item.setHangable(thing.hangable());
        item.setHookSouth(thing.isVertical());
        item.setHookEast(thing.isHorizontal());
        item.setIgnoreLook(thing.ignoreLook());
        item.setAllowDistanceRead(false);
        item.setHasCharges(false);

        boolean modernFlags = options.clientVersion() >= FORCE_USE_MIN_VERSION;
        item.setForceUse(modernFlags && thing.forceUse());
        item.setFullGround(modernFlags && thing.isFullGround());

        item.setAnimation(expectedAnimation(thing));

        item.setLightLevel(thing.lightLevel());
        item.setLightColor(thing.lightColor());
        item.setGroundSpeed(item.type() == ServerItemType.GROUND ? thing.groundSpeed() : 0);
        item.setMinimapColor(thing.miniMapColor());
        item.setMaxReadWriteChars(thing.writable() ? thing.maxReadWriteChars() : 0);
        item.setMaxReadChars(thing.writableOnce() ? thing.maxReadChars() : 0);

        TileStackOrder order = expectedStackOrder(thing);
        item.setStackOrder(order);
        item.setHasStackOrder(order != TileStackOrder.NONE);

        if (!thing.marketName().isEmpty()) {
            item.setName(thing.marketName());
        }
        if (thing.marketTradeAs() != 0) {
            item.setTradeAs(thing.marketTradeAs());
        }
    }

    public static ServerItem createFromThingType(ThingType thing, int serverId) {
        return createFromThingType(thing, serverId, SyncOptions.defaults());
    }

    /**
     * Builds a new item for {@code thing} with the given server id. The type is always derived from
     * the thing, whatever {@link SyncOptions#syncType()} says.
     */
    public static ServerItem createFromThingType(ThingType thing, int serverId, SyncOptions options) {
        Objects.requireNonNull(thing, "thing");
        Objects.requireNonNull(options, "options");
        ServerItem item = new ServerItem(serverId, thing.id());
        syncFromThingType(item, thing, options.toBuilder().syncType(true).build());
        if (item.spriteHash() == null) {
            item.setSpriteHash(ServerItem.emptySpriteHash());
        }
        return item;
    }

    /**
     * Same as {@link #flagsMatch(ServerItem, ThingType, int)} with client version 0.
     */
    public static boolean flagsMatch(ServerItem item, ThingType thing) {
        return flagsMatch(item, thing, 0);
    }

    /**
     * Returns true when syncing {@code item} from {@code thing} would not change its type, flags,
     * stack order or read limits. Name, tradeAs, sprite hash and xml attributes are not compared.
     *
     * <p>The whole {@link ServerItem#flags()} word is compared, so forceUse and fullGround must match what
     * {@code clientVersion} allows, and hasCharges and allowDistanceRead must be clear. Pass the client version
     * the items were synced with; an item holding forceUse checked at version 0 does not match.
     */
    public static boolean flagsMatch(ServerItem item, ThingType thing, int clientVersion) {
        Objects.requireNonNull(item, "item");
        Objects.requireNonNull(thing, "thing");

        ServerItem expected = new ServerItem();
        syncFromThingType(expected, thing, SyncOptions.builder()
                .syncType(true)
                .clientVersion(clientVersion)
                .build());

        if (item.type() != expected.type()) return false;
        if (item.flags() != expected.flags()) return false;
        if (item.stackOrder() != expected.stackOrder()) return false;
        if (thing.writable() && item.maxReadWriteChars() != expected.maxReadWriteChars()) return false;
        if (thing.writableOnce() && item.maxReadChars() != expected.maxReadChars()) return false;
        return true;
    }

    /**
     * Ground, then container, fluid container and fluid; anything else is {@link ServerItemType#NONE}.
     */
    public static ServerItemType expectedType(ThingType thing) {
        if (thing.isGround()) return ServerItemType.GROUND;
        if (thing.isContainer()) return ServerItemType.CONTAINER;
        if (thing.isFluidContainer()) return ServerItemType.FLUID;
        if (thing.isFluid()) return ServerItemType.SPLASH;
        return ServerItemType.NONE;
    }

    static TileStackOrder expectedStackOrder(ThingType thing) {
        if (thing.isGroundBorder()) return TileStackOrder.BORDER;
        if (thing.isOnBottom()) return TileStackOrder.BOTTOM;
        if (thing.isOnTop()) return TileStackOrder.TOP;
        return TileStackOrder.NONE;
    }

    static boolean expectedReadable(ThingType thing) {
        return thing.writable()
                || thing.writableOnce()
                || (thing.isLensHelp() && thing.lensHelp() == READABLE_LENS_HELP);
    }

    static boolean expectedAnimation(ThingType thing) {
        FrameGroup group = thing.defaultFrameGroup();
        return group != null && group.frames() > 1;
    }
}
