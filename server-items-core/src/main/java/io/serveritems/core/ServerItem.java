package io.serveritems.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One server-visible item definition.
 *
 * <p>Mutable: codecs populate it field by field and the sync engine rewrites it in place.
 * A new instance is movable and has every other flag cleared.
 */
public final class ServerItem {

    /** Length in bytes of {@link #spriteHash()}. */
    public static final int SPRITE_HASH_LENGTH = 16;

    private int id;
    private int clientId;
    private int previousClientId;
    private ServerItemType type = ServerItemType.NONE;
    private TileStackOrder stackOrder = TileStackOrder.NONE;
    private boolean hasStackOrder;
    private String name = "";
    private byte[] spriteHash;
    private boolean spriteAssigned;
    private boolean customCreated;

    private boolean unpassable;
    private boolean blockMissiles;
    private boolean blockPathfinder;
    private boolean hasElevation;
    private boolean forceUse;
    private boolean multiUse;
    private boolean pickupable;
    private boolean movable = true;
    private boolean stackable;
    private boolean readable;
    private boolean rotatable;
    private boolean hangable;
    private boolean hookSouth;
    private boolean hookEast;
    private boolean hasCharges;
    private boolean ignoreLook;
    private boolean allowDistanceRead;
    private boolean animation;
    private boolean fullGround;

    private int groundSpeed;
    private int lightLevel;
    private int lightColor;
    private int maxReadChars;
    private int maxReadWriteChars;
    private int minimapColor;
    private int tradeAs;

    private final Map<String, XmlAttributeValue> xmlAttributes = new LinkedHashMap<>();

    public ServerItem() {
    }

    public ServerItem(int id, int clientId) {
        this.id = id;
        this.clientId = clientId;
    }

    /**
     * Returns an independent copy, including the sprite hash bytes and the xml attributes.
     */
    public ServerItem copy() {
        ServerItem c = new ServerItem(id, clientId);
        c.previousClientId = previousClientId;
        c.type = type;
        c.stackOrder = stackOrder;
        c.hasStackOrder = hasStackOrder;
        c.name = name;
        c.spriteHash = spriteHash == null ? null : spriteHash.clone();
        c.spriteAssigned = spriteAssigned;
        c.customCreated = customCreated;
        c.applyFlags(flags());
        c.groundSpeed = groundSpeed;
        c.lightLevel = lightLevel;
        c.lightColor = lightColor;
        c.maxReadChars = maxReadChars;
        c.maxReadWriteChars = maxReadWriteChars;
        c.minimapColor = minimapColor;
        c.tradeAs = tradeAs;
        c.xmlAttributes.putAll(xmlAttributes);
        return c;
    }

    /**
     * Packs the modeled flags into an OTB flags word. {@code hasStackOrder} maps to {@link ServerItemFlag#STACK_ORDER}.
     */
    public int flags() {
        int flags = 0;
        if (unpassable) flags |= ServerItemFlag.UNPASSABLE.mask();
        if (blockMissiles) flags |= ServerItemFlag.BLOCK_MISSILES.mask();
        if (blockPathfinder) flags |= ServerItemFlag.BLOCK_PATHFINDER.mask();
        if (hasElevation) flags |= ServerItemFlag.HAS_ELEVATION.mask();
        if (forceUse) flags |= ServerItemFlag.FORCE_USE.mask();
        if (multiUse) flags |= ServerItemFlag.MULTI_USE.mask();
        if (pickupable) flags |= ServerItemFlag.PICKUPABLE.mask();
        if (movable) flags |= ServerItemFlag.MOVABLE.mask();
        if (stackable) flags |= ServerItemFlag.STACKABLE.mask();
        if (hasStackOrder) flags |= ServerItemFlag.STACK_ORDER.mask();
        if (readable) flags |= ServerItemFlag.READABLE.mask();
        if (rotatable) flags |= ServerItemFlag.ROTATABLE.mask();
        if (hangable) flags |= ServerItemFlag.HANGABLE.mask();
        if (hookSouth) flags |= ServerItemFlag.HOOK_SOUTH.mask();
        if (hookEast) flags |= ServerItemFlag.HOOK_EAST.mask();
        if (hasCharges) flags |= ServerItemFlag.CLIENT_CHARGES.mask();
        if (ignoreLook) flags |= ServerItemFlag.IGNORE_LOOK.mask();
        if (allowDistanceRead) flags |= ServerItemFlag.ALLOW_DISTANCE_READ.mask();
        if (animation) flags |= ServerItemFlag.IS_ANIMATION.mask();
        if (fullGround) flags |= ServerItemFlag.FULL_GROUND.mask();
        return flags;
    }

    /**
     * Sets every modeled flag from an OTB flags word. Bits without a field are ignored.
     */
    public void applyFlags(int flags) {
        unpassable = ServerItemFlag.UNPASSABLE.isSet(flags);
        blockMissiles = ServerItemFlag.BLOCK_MISSILES.isSet(flags);
        blockPathfinder = ServerItemFlag.BLOCK_PATHFINDER.isSet(flags);
        hasElevation = ServerItemFlag.HAS_ELEVATION.isSet(flags);
        forceUse = ServerItemFlag.FORCE_USE.isSet(flags);
        multiUse = ServerItemFlag.MULTI_USE.isSet(flags);
        pickupable = ServerItemFlag.PICKUPABLE.isSet(flags);
        movable = ServerItemFlag.MOVABLE.isSet(flags);
        stackable = ServerItemFlag.STACKABLE.isSet(flags);
        hasStackOrder = ServerItemFlag.STACK_ORDER.isSet(flags);
        readable = ServerItemFlag.READABLE.isSet(flags);
        rotatable = ServerItemFlag.ROTATABLE.isSet(flags);
        hangable = ServerItemFlag.HANGABLE.isSet(flags);
        hookSouth = ServerItemFlag.HOOK_SOUTH.isSet(flags);
        hookEast = ServerItemFlag.HOOK_EAST.isSet(flags);
        hasCharges = ServerItemFlag.CLIENT_CHARGES.isSet(flags);
        ignoreLook = ServerItemFlag.IGNORE_LOOK.isSet(flags);
        allowDistanceRead = ServerItemFlag.ALLOW_DISTANCE_READ.isSet(flags);
        animation = ServerItemFlag.IS_ANIMATION.isSet(flags);
        fullGround = ServerItemFlag.FULL_GROUND.isSet(flags);
    }

    public int id() {
        return id;
    }

    public void setId(int id) {
        this.id = id;
    }

    public int clientId() {
        return clientId;
    }

    public void setClientId(int clientId) {
        this.clientId = clientId;
    }

    public int previousClientId() {
        return previousClientId;
    }

    public void setPreviousClientId(int previousClientId) {
        this.previousClientId = previousClientId;
    }

    public ServerItemType type() {
        return type;
    }

    public void setType(ServerItemType type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public boolean isDeprecated() {
        return type == ServerItemType.DEPRECATED;
    }

    public TileStackOrder stackOrder() {
        return stackOrder;
    }

    public void setStackOrder(TileStackOrder stackOrder) {
        this.stackOrder = Objects.requireNonNull(stackOrder, "stackOrder");
    }

    public boolean hasStackOrder() {
        return hasStackOrder;
    }

    public void setHasStackOrder(boolean hasStackOrder) {
        this.hasStackOrder = hasStackOrder;
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name == null ? "" : name;
    }

    /**
     * 16-byte sprite digest, or null. Only deprecated items may have none.
     * The returned array is the stored one.
     */
    public byte[] spriteHash() {
        return spriteHash;
    }

    public void setSpriteHash(byte[] spriteHash) {
        this.spriteHash = spriteHash;
    }

    public boolean spriteAssigned() {
        return spriteAssigned;
    }

    public void setSpriteAssigned(boolean spriteAssigned) {
        this.spriteAssigned = spriteAssigned;
    }

    public boolean customCreated() {
        return customCreated;
    }

    public void setCustomCreated(boolean customCreated) {
        this.customCreated = customCreated;
    }

    public boolean unpassable() {
        return unpassable;
    }

    public void setUnpassable(boolean unpassable) {
        this.unpassable = unpassable;
    }

    public boolean blockMissiles() {
        return blockMissiles;
    }

    public void setBlockMissiles(boolean blockMissiles) {
        this.blockMissiles = blockMissiles;
    }

    public boolean blockPathfinder() {
        return blockPathfinder;
    }

    public void setBlockPathfinder(boolean blockPathfinder) {
        this.blockPathfinder = blockPathfinder;
    }

    public boolean hasElevation() {
        return hasElevation;
    }

    public void setHasElevation(boolean hasElevation) {
        this.hasElevation = hasElevation;
    }

    public boolean forceUse() {
        return forceUse;
    }

    public void setForceUse(boolean forceUse) {
        this.forceUse = forceUse;
    }

    public boolean multiUse() {
        return multiUse;
    }

    public void setMultiUse(boolean multiUse) {
        this.multiUse = multiUse;
    }

    public boolean pickupable() {
        return pickupable;
    }

    public void setPickupable(boolean pickupable) {
        this.pickupable = pickupable;
    }

    public boolean movable() {
        return movable;
    }

    public void setMovable(boolean movable) {
        this.movable = movable;
    }

    public boolean stackable() {
        return stackable;
    }

    public void setStackable(boolean stackable) {
        this.stackable = stackable;
    }

    public boolean readable() {
        return readable;
    }

    public void setReadable(boolean readable) {
        this.readable = readable;
    }

    public boolean rotatable() {
        return rotatable;
    }

    public void setRotatable(boolean rotatable) {
        this.rotatable = rotatable;
    }

    public boolean hangable() {
        return hangable;
    }

    public void setHangable(boolean hangable) {
        this.hangable = hangable;
    }

    public boolean hookSouth() {
        return hookSouth;
    }

    public void setHookSouth(boolean hookSouth) {
        this.hookSouth = hookSouth;
    }

    public boolean hookEast() {
        return hookEast;
    }

    public void setHookEast(boolean hookEast) {
        this.hookEast = hookEast;
    }

    public boolean hasCharges() {
        return hasCharges;
    }

    public void setHasCharges(boolean hasCharges) {
        this.hasCharges = hasCharges;
    }

    public boolean ignoreLook() {
        return ignoreLook;
    }

    public void setIgnoreLook(boolean ignoreLook) {
        this.ignoreLook = ignoreLook;
    }

    public boolean allowDistanceRead() {
        return allowDistanceRead;
    }

    public void setAllowDistanceRead(boolean allowDistanceRead) {
        this.allowDistanceRead = allowDistanceRead;
    }

    public boolean isAnimation() {
        return animation;
    }

    public void setAnimation(boolean animation) {
        this.animation = animation;
    }

    public boolean fullGround() {
        return fullGround;
    }

    public void setFullGround(boolean fullGround) {
        this.fullGround = fullGround;
    }

    public int groundSpeed() {
        return groundSpeed;
    }

    public void setGroundSpeed(int groundSpeed) {
        this.groundSpeed = groundSpeed;
    }

    public int lightLevel() {
        return lightLevel;
    }

    public void setLightLevel(int lightLevel) {
        this.lightLevel = lightLevel;
    }

    public int lightColor() {
        return lightColor;
    }

    public void setLightColor(int lightColor) {
        this.lightColor = lightColor;
    }

    public int maxReadChars() {
        return maxReadChars;
    }

    public void setMaxReadChars(int maxReadChars) {
        this.maxReadChars = maxReadChars;
    }

    public int maxReadWriteChars() {
        return maxReadWriteChars;
    }

    public void setMaxReadWriteChars(int maxReadWriteChars) {
        this.maxReadWriteChars = maxReadWriteChars;
    }

    public int minimapColor() {
        return minimapColor;
    }

    public void setMinimapColor(int minimapColor) {
        this.minimapColor = minimapColor;
    }

    public int tradeAs() {
        return tradeAs;
    }

    public void setTradeAs(int tradeAs) {
        this.tradeAs = tradeAs;
    }

    // items.xml data

    /**
     * Read-only view of the items.xml attributes, in insertion order.
     */
    public Map<String, XmlAttributeValue> xmlAttributes() {
        return Collections.unmodifiableMap(xmlAttributes);
    }

    public boolean hasXmlData() {
        return !xmlAttributes.isEmpty();
    }

    public XmlAttributeValue xmlAttribute(String key) {
        return xmlAttributes.get(key);
    }

    /**
     * Plain string value for {@code key}, or null when absent or nested.
     */
    public String xmlAttributeString(String key) {
        XmlAttributeValue value = xmlAttributes.get(key);
        if (value instanceof XmlAttributeValue.Leaf) {
            return ((XmlAttributeValue.Leaf) value).value();
        }
        return null;
    }

    public void setXmlAttribute(String key, XmlAttributeValue value) {
        xmlAttributes.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    }

    public void setXmlAttribute(String key, String value) {
        setXmlAttribute(key, XmlAttributeValue.of(value));
    }

    public void removeXmlAttribute(String key) {
        xmlAttributes.remove(key);
    }

    public void clearXmlAttributes() {
        xmlAttributes.clear();
    }

    @Override
    public String toString() {
        return "ServerItem{id=" + id + ", clientId=" + clientId + ", type=" + type
                + ", name='" + name + "', spriteHash=" + (spriteHash == null ? "null" : ContentHash.toHex(spriteHash)) + "}";
    }

    /**
     * Placeholder hash given to non-deprecated items that have none.
     */
    public static byte[] emptySpriteHash() {
        return new byte[SPRITE_HASH_LENGTH];
    }
}
