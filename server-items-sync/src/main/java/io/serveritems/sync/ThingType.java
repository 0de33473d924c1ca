package io.serveritems.sync;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Client-side appearance record read by the sync engine. Immutable; build with {@link #builder(int)}.
 *
 * <p>Only the properties that influence server items are modeled.
 */
public final class ThingType {
    private final int id;
    private final ThingCategory category;
    private final String name;
    private final boolean isGround;
    private final int groundSpeed;
    private final boolean isGroundBorder;
    private final boolean isOnBottom;
    private final boolean isOnTop;
    private final boolean isContainer;
    private final boolean stackable;
    private final boolean forceUse;
    private final boolean multiUse;
    private final boolean hasCharges;
    private final boolean writable;
    private final boolean writableOnce;
    private final int maxReadWriteChars;
    private final int maxReadChars;
    private final boolean isFluidContainer;
    private final boolean isFluid;
    private final boolean isUnpassable;
    private final boolean isUnmoveable;
    private final boolean blockMissile;
    private final boolean blockPathfind;
    private final boolean noMoveAnimation;
    private final boolean pickupable;
    private final boolean hangable;
    private final boolean isVertical;
    private final boolean isHorizontal;
    private final boolean rotatable;
    private final boolean hasLight;
    private final int lightLevel;
    private final int lightColor;
    private final boolean hasElevation;
    private final boolean animateAlways;
    private final boolean miniMap;
    private final int miniMapColor;
    private final boolean isLensHelp;
    private final int lensHelp;
    private final boolean isFullGround;
    private final boolean ignoreLook;
    private final boolean isMarketItem;
    private final String marketName;
    private final int marketTradeAs;
    private final Map<FrameGroupType, FrameGroup> frameGroups;

    private ThingType(Builder b) {
        this.id = b.id;
        this.category = b.category;
        this.name = b.name;
        this.isGround = b.isGround;
        this.groundSpeed = b.groundSpeed;
        this.isGroundBorder = b.isGroundBorder;
        this.isOnBottom = b.isOnBottom;
        this.isOnTop = b.isOnTop;
        this.isContainer = b.isContainer;
        this.stackable = b.stackable;
        this.forceUse = b.forceUse;
        this.multiUse = b.multiUse;
        this.hasCharges = b.hasCharges;
        this.writable = b.writable;
        this.writableOnce = b.writableOnce;
        this.maxReadWriteChars = b.maxReadWriteChars;
        this.maxReadChars = b.maxReadChars;
        this.isFluidContainer = b.isFluidContainer;
        this.isFluid = b.isFluid;
        this.isUnpassable = b.isUnpassable;
        this.isUnmoveable = b.isUnmoveable;
        this.blockMissile = b.blockMissile;
        this.blockPathfind = b.blockPathfind;
        this.noMoveAnimation = b.noMoveAnimation;
        this.pickupable = b.pickupable;
        this.hangable = b.hangable;
        this.isVertical = b.isVertical;
        this.isHorizontal = b.isHorizontal;
        this.rotatable = b.rotatable;
        this.hasLight = b.hasLight;
        this.lightLevel = b.lightLevel;
        this.lightColor = b.lightColor;
        this.hasElevation = b.hasElevation;
        this.animateAlways = b.animateAlways;
        this.miniMap = b.miniMap;
        this.miniMapColor = b.miniMapColor;
        this.isLensHelp = b.isLensHelp;
        this.lensHelp = b.lensHelp;
        this.isFullGround = b.isFullGround;
        this.ignoreLook = b.ignoreLook;
        this.isMarketItem = b.isMarketItem;
        this.marketName = b.marketName;
        this.marketTradeAs = b.marketTradeAs;
        this.frameGroups = Map.copyOf(b.frameGroups);
    }

    public static Builder builder(int id) {
        return new Builder(id);
    }

    public int id() {
        return id;
    }

    public ThingCategory category() {
        return category;
    }

    public String name() {
        return name;
    }

    /**
     * Frame group of the given type, or null if the thing has none.
     */
    public FrameGroup frameGroup(FrameGroupType type) {
        return frameGroups.get(type);
    }

    public FrameGroup defaultFrameGroup() {
        return frameGroups.get(FrameGroupType.DEFAULT);
    }

    public boolean isGround() {
        return isGround;
    }

    public int groundSpeed() {
        return groundSpeed;
    }

    public boolean isGroundBorder() {
        return isGroundBorder;
    }

    public boolean isOnBottom() {
        return isOnBottom;
    }

    public boolean isOnTop() {
        return isOnTop;
    }

    public boolean isContainer() {
        return isContainer;
    }

    public boolean stackable() {
        return stackable;
    }

    public boolean forceUse() {
        return forceUse;
    }

    public boolean multiUse() {
        return multiUse;
    }

    public boolean hasCharges() {
        return hasCharges;
    }

    public boolean writable() {
        return writable;
    }

    public boolean writableOnce() {
        return writableOnce;
    }

    public int maxReadWriteChars() {
        return maxReadWriteChars;
    }

    public int maxReadChars() {
        return maxReadChars;
    }

    public boolean isFluidContainer() {
        return isFluidContainer;
    }

    public boolean isFluid() {
        return isFluid;
    }

    public boolean isUnpassable() {
        return isUnpassable;
    }

    public boolean isUnmoveable() {
        return isUnmoveable;
    }

    public boolean blockMissile() {
        return blockMissile;
    }

    public boolean blockPathfind() {
        return blockPathfind;
    }

    public boolean noMoveAnimation() {
        return noMoveAnimation;
    }

    public boolean pickupable() {
        return pickupable;
    }

    public boolean hangable() {
        return hangable;
    }

    public boolean isVertical() {
        return isVertical;
    }

    public boolean isHorizontal() {
        return isHorizontal;
    }

    public boolean rotatable() {
        return rotatable;
    }

    public boolean hasLight() {
        return hasLight;
    }

    public int lightLevel() {
        return lightLevel;
    }

    public int lightColor() {
        return lightColor;
    }

    public boolean hasElevation() {
        return hasElevation;
    }

    public boolean animateAlways() {
        return animateAlways;
    }

    public boolean miniMap() {
        return miniMap;
    }

    public int miniMapColor() {
        return miniMapColor;
    }

    public boolean isLensHelp() {
        return isLensHelp;
    }

    public int lensHelp() {
        return lensHelp;
    }

    public boolean isFullGround() {
        return isFullGround;
    }

    public boolean ignoreLook() {
        return ignoreLook;
    }

    public boolean isMarketItem() {
        return isMarketItem;
    }

    public String marketName() {
        return marketName;
    }

    public int marketTradeAs() {
        return marketTradeAs;
    }

    public static final class Builder {
        private final int id;
        private ThingCategory category = ThingCategory.ITEM;
        private String name = "";
        private boolean isGround;
        private int groundSpeed;
        private boolean isGroundBorder;
        private boolean isOnBottom;
        private boolean isOnTop;
        private boolean isContainer;
        private boolean stackable;
        private boolean forceUse;
        private boolean multiUse;
        private boolean hasCharges;
        private boolean writable;
        private boolean writableOnce;
        private int maxReadWriteChars;
        private int maxReadChars;
        private boolean isFluidContainer;
        private boolean isFluid;
        private boolean isUnpassable;
        private boolean isUnmoveable;
        private boolean blockMissile;
        private boolean blockPathfind;
        private boolean noMoveAnimation;
        private boolean pickupable;
        private boolean hangable;
        private boolean isVertical;
        private boolean isHorizontal;
        private boolean rotatable;
        private boolean hasLight;
        private int lightLevel;
        private int lightColor;
        private boolean hasElevation;
        private boolean animateAlways;
        private boolean miniMap;
        private int miniMapColor;
        private boolean isLensHelp;
        private int lensHelp;
        private boolean isFullGround;
        private boolean ignoreLook;
        private boolean isMarketItem;
        private String marketName = "";
        private int marketTradeAs;
        private final Map<FrameGroupType, FrameGroup> frameGroups = new EnumMap<>(FrameGroupType.class);

        private Builder(int id) {
            this.id = id;
        }

        public Builder category(ThingCategory category) {
            this.category = Objects.requireNonNull(category, "category");
            return this;
        }

        public Builder name(String name) {
            this.name = name == null ? "" : name;
            return this;
        }

        public Builder frameGroup(FrameGroup group) {
            Objects.requireNonNull(group, "group");
            frameGroups.put(group.type(), group);
            return this;
        }

        public Builder isGround(boolean isGround) {
            this.isGround = isGround;
            return this;
        }

        public Builder groundSpeed(int groundSpeed) {
            this.groundSpeed = groundSpeed;
            return this;
        }

        public Builder isGroundBorder(boolean isGroundBorder) {
            this.isGroundBorder = isGroundBorder;
            return this;
        }

        public Builder isOnBottom(boolean isOnBottom) {
            this.isOnBottom = isOnBottom;
            return this;
        }

        public Builder isOnTop(boolean isOnTop) {
            this.isOnTop = isOnTop;
            return this;
        }

        public Builder isContainer(boolean isContainer) {
            this.isContainer = isContainer;
            return this;
        }

        public Builder stackable(boolean stackable) {
            this.stackable = stackable;
            return this;
        }

        public Builder forceUse(boolean forceUse) {
            this.forceUse = forceUse;
            return this;
        }

        public Builder multiUse(boolean multiUse) {
            this.multiUse = multiUse;
            return this;
        }

        public Builder hasCharges(boolean hasCharges) {
            this.hasCharges = hasCharges;
            return this;
        }

        public Builder writable(boolean writable) {
            this.writable = writable;
            return this;
        }

        public Builder writableOnce(boolean writableOnce) {
            this.writableOnce = writableOnce;
            return this;
        }

        public Builder maxReadWriteChars(int maxReadWriteChars) {
            this.maxReadWriteChars = maxReadWriteChars;
            return this;
        }

        public Builder maxReadChars(int maxReadChars) {
            this.maxReadChars = maxReadChars;
            return this;
        }

        public Builder isFluidContainer(boolean isFluidContainer) {
            this.isFluidContainer = isFluidContainer;
            return this;
        }

        public Builder isFluid(boolean isFluid) {
            this.isFluid = isFluid;
            return this;
        }

        public Builder isUnpassable(boolean isUnpassable) {
            this.isUnpassable = isUnpassable;
            return this;
        }

        public Builder isUnmoveable(boolean isUnmoveable) {
            this.isUnmoveable = isUnmoveable;
            return this;
        }

        public Builder blockMissile(boolean blockMissile) {
            this.blockMissile = blockMissile;
            return this;
        }

        public Builder blockPathfind(boolean blockPathfind) {
            this.blockPathfind = blockPathfind;
            return this;
        }

        public Builder noMoveAnimation(boolean noMoveAnimation) {
            this.noMoveAnimation = noMoveAnimation;
            return this;
        }

        public Builder pickupable(boolean pickupable) {
            this.pickupable = pickupable;
            return this;
        }

        public Builder hangable(boolean hangable) {
            this.hangable = hangable;
            return this;
        }

        public Builder isVertical(boolean isVertical) {
            this.isVertical = isVertical;
            return this;
        }

        public Builder isHorizontal(boolean isHorizontal) {
            this.isHorizontal = isHorizontal;
            return this;
        }

        public Builder rotatable(boolean rotatable) {
            this.rotatable = rotatable;
            return this;
        }

        public Builder hasLight(boolean hasLight) {
            this.hasLight = hasLight;
            return this;
        }

        public Builder lightLevel(int lightLevel) {
            this.lightLevel = lightLevel;
            return this;
        }

        public Builder lightColor(int lightColor) {
            this.lightColor = lightColor;
            return this;
        }

        public Builder hasElevation(boolean hasElevation) {
            this.hasElevation = hasElevation;
            return this;
        }

        public Builder animateAlways(boolean animateAlways) {
            this.animateAlways = animateAlways;
            return this;
        }

        public Builder miniMap(boolean miniMap) {
            this.miniMap = miniMap;
            return this;
        }

        public Builder miniMapColor(int miniMapColor) {
            this.miniMapColor = miniMapColor;
            return this;
        }

        public Builder isLensHelp(boolean isLensHelp) {
            this.isLensHelp = isLensHelp;
            return this;
        }

        public Builder lensHelp(int lensHelp) {
            this.lensHelp = lensHelp;
            return this;
        }

        public Builder isFullGround(boolean isFullGround) {
            this.isFullGround = isFullGround;
            return this;
        }

        public Builder ignoreLook(boolean ignoreLook) {
            this.ignoreLook = ignoreLook;
            return this;
        }

        public Builder isMarketItem(boolean isMarketItem) {
            this.isMarketItem = isMarketItem;
            return this;
        }

        public Builder marketName(String marketName) {
            this.marketName = marketName == null ? "" : marketName;
            return this;
        }

        public Builder marketTradeAs(int marketTradeAs) {
            this.marketTradeAs = marketTradeAs;
            return this;
        }

        public ThingType build() {
            return new ThingType(this);
        }
    }
}
