package io.serveritems.xml;

import io.serveritems.attributes.AttributeSchema;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Validation settings for {@link ItemsXmlReader}.
 *
 * <p>Nested attribute keys are compared case-insensitively; an empty known set disables that check.
 * Tag attribute keys are compared exactly.
 */
public final class ItemsXmlReadOptions {
    public static final List<String> DEFAULT_TAG_ATTRIBUTES = List.of("name", "article", "plural", "editorsuffix");

    private final Set<String> knownAttributes;
    private final Set<String> knownTagAttributes;

    private ItemsXmlReadOptions(Builder b) {
        this.knownAttributes = Set.copyOf(b.knownAttributes);
        this.knownTagAttributes = Set.copyOf(b.knownTagAttributes);
    }

    public static ItemsXmlReadOptions defaults() {
        return builder().build();
    }

    /**
     * Options validating against every key of {@code schema}. Schemas without tag placements fall back to the
     * default tag attributes.
     */
    public static ItemsXmlReadOptions forSchema(AttributeSchema schema) {
        Objects.requireNonNull(schema, "schema");
        Builder b = builder().knownAttributes(schema.attributeKeysInOrder());
        List<String> tags = schema.tagAttributeKeys();
        if (!tags.isEmpty()) {
            b.knownTagAttributes(tags);
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Lower-cased known nested attribute keys.
     */
    public Set<String> knownAttributes() {
        return knownAttributes;
    }

    public Set<String> knownTagAttributes() {
        return knownTagAttributes;
    }

    boolean isKnownAttribute(String key) {
        return knownAttributes.isEmpty() || knownAttributes.contains(key.toLowerCase(Locale.ROOT));
    }

    boolean isKnownTagAttribute(String key) {
        return knownTagAttributes.contains(key);
    }

    public static final class Builder {
        private final Set<String> knownAttributes = new LinkedHashSet<>();
        private final Set<String> knownTagAttributes = new LinkedHashSet<>(DEFAULT_TAG_ATTRIBUTES);

        private Builder() {
        }

        public Builder knownAttributes(Collection<String> keys) {
            Objects.requireNonNull(keys, "keys");
            knownAttributes.clear();
            for (String k : keys) {
                knownAttributes.add(k.toLowerCase(Locale.ROOT));
            }
            return this;
        }

        public Builder knownTagAttributes(Collection<String> keys) {
            Objects.requireNonNull(keys, "keys");
            knownTagAttributes.clear();
            knownTagAttributes.addAll(keys);
            return this;
        }

        public ItemsXmlReadOptions build() {
            return new ItemsXmlReadOptions(this);
        }
    }
}
