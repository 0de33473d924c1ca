package io.serveritems.attributes;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Attribute definitions of one server dialect, in definition order.
 *
 * @param server dialect id, e.g. {@code tfs1.4}
 * @param displayName human readable name
 * @param supportsFromToId whether items.xml may use {@code fromid/toid} ranges
 * @param itemsXmlEncoding encoding declared in written items.xml files
 * @param attributes top level attribute definitions
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AttributeSchema(
        String server,
        String displayName,
        Boolean supportsFromToId,
        String itemsXmlEncoding,
        List<ItemAttribute> attributes) {

    public static final String DEFAULT_ENCODING = "iso-8859-1";

    public AttributeSchema {
        Objects.requireNonNull(server, "server");
        if (displayName == null || displayName.isEmpty()) displayName = server;
        if (supportsFromToId == null) supportsFromToId = Boolean.TRUE;
        if (itemsXmlEncoding == null || itemsXmlEncoding.isEmpty()) itemsXmlEncoding = DEFAULT_ENCODING;
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    public boolean fromToIdSupported() {
        return supportsFromToId;
    }

    public AttributeSchemaMetadata metadata() {
        return new AttributeSchemaMetadata(server, displayName, supportsFromToId, itemsXmlEncoding);
    }

    /**
     * Distinct categories in definition order.
     */
    public List<String> categories() {
        Set<String> seen = new LinkedHashSet<>();
        for (ItemAttribute a : attributes) {
            seen.add(a.category());
        }
        return List.copyOf(seen);
    }

    public List<ItemAttribute> attributesByCategory(String category) {
        List<ItemAttribute> out = new ArrayList<>();
        for (ItemAttribute a : attributes) {
            if (a.category().equals(category)) out.add(a);
        }
        return out;
    }

    /**
     * Every key, nested children included, depth first in definition order.
     */
    public List<String> attributeKeysInOrder() {
        List<String> keys = new ArrayList<>();
        for (ItemAttribute a : attributes) {
            collectKeys(a, keys);
        }
        return keys;
    }

    public List<String> tagAttributeKeys() {
        List<String> keys = new ArrayList<>();
        for (ItemAttribute a : attributes) {
            if (a.isTag()) keys.add(a.key());
        }
        return keys;
    }

    /**
     * Keys that appear as nested {@code <attribute>} elements, children included.
     */
    public Set<String> nestedAttributeKeys() {
        Set<String> keys = new LinkedHashSet<>();
        for (ItemAttribute a : attributes) {
            if (!a.isTag()) collectKeys(a, keys);
        }
        return Collections.unmodifiableSet(keys);
    }

    /**
     * {@code key -> order} for attributes that declare an explicit order.
     */
    public Map<String, Integer> attributePriority() {
        Map<String, Integer> out = new LinkedHashMap<>();
        collectPriority(attributes, out);
        return out;
    }

    /**
     * Top level attributes whose key contains {@code keyword}, ignoring case.
     */
    public List<ItemAttribute> searchAttributes(String keyword) {
        String lower = keyword.toLowerCase(Locale.ROOT);
        List<ItemAttribute> out = new ArrayList<>();
        for (ItemAttribute a : attributes) {
            if (a.key().toLowerCase(Locale.ROOT).contains(lower)) out.add(a);
        }
        return out;
    }

    private static void collectKeys(ItemAttribute attribute, Collection<String> out) {
        out.add(attribute.key());
        for (ItemAttribute child : attribute.children()) {
            collectKeys(child, out);
        }
    }

    private static void collectPriority(List<ItemAttribute> attrs, Map<String, Integer> out) {
        for (ItemAttribute a : attrs) {
            if (a.hasExplicitOrder()) out.put(a.key(), a.order());
            collectPriority(a.children(), out);
        }
    }
}
