package io.serveritems.sync;

public enum ThingCategory {
    ITEM(1),
    OUTFIT(2),
    EFFECT(3),
    MISSILE(4);

    private final int value;

    ThingCategory(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public static ThingCategory fromValue(int value) {
        for (ThingCategory c : values()) {
            if (c.value == value) return c;
        }
        return null;
    }
}
