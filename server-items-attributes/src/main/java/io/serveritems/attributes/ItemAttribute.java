package io.serveritems.attributes;

import java.util.List;
import java.util.Objects;

/**
 * Definition of one items.xml attribute within a server schema.
 *
 * @param key attribute key as written in items.xml
 * @param type value type
 * @param category display grouping
 * @param placement tag or nested; defaults to nested
 * @param order write priority; {@link #NO_ORDER} when unspecified
 * @param values allowed values, or null when unrestricted
 * @param attributes nested child definitions, or null
 */
public record ItemAttribute(
        String key,
        AttributeType type,
        String category,
        Placement placement,
        Integer order,
        List<String> values,
        List<ItemAttribute> attributes) {

    public static final int NO_ORDER = Integer.MAX_VALUE;

    public ItemAttribute {
        Objects.requireNonNull(key, "key");
        if (type == null) type = AttributeType.STRING;
        if (category == null) category = "General";
        if (placement == null) placement = Placement.NESTED;
        if (order == null) order = NO_ORDER;
        values = values == null ? null : List.copyOf(values);
        attributes = attributes == null ? null : List.copyOf(attributes);
    }

    public static ItemAttribute of(String key, AttributeType type, String category) {
        return new ItemAttribute(key, type, category, null, null, null, null);
    }

    public boolean hasExplicitOrder() {
        return order != NO_ORDER;
    }

    public boolean isTag() {
        return placement == Placement.TAG;
    }

    public List<ItemAttribute> children() {
        return attributes == null ? List.of() : attributes;
    }
}
