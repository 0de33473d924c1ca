package io.serveritems.attributes;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where an attribute lives in items.xml: on the {@code <item>} tag itself, or as a nested
 * {@code <attribute key=".." value=".."/>} element.
 */
public enum Placement {
    TAG,
    NESTED;

    @JsonCreator
    public static Placement fromJson(String value) {
        if (value == null || value.isBlank()) return NESTED;
        return "tag".equals(value.trim().toLowerCase(Locale.ROOT)) ? TAG : NESTED;
    }

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
