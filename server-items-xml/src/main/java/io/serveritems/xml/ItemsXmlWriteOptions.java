package io.serveritems.xml;

import io.serveritems.attributes.AttributeSchema;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output settings for {@link ItemsXmlWriter}.
 */
public final class ItemsXmlWriteOptions {
    public static final String DEFAULT_ENCODING = "iso-8859-1";
    public static final List<String> DEFAULT_TAG_ATTRIBUTE_KEYS = List.of("article", "name", "plural", "editorsuffix");

    private final String encoding;
    private final List<String> tagAttributeKeys;
    private final boolean supportsFromToId;
    private final Map<String, Integer> attributePriority;

    private ItemsXmlWriteOptions(Builder b) {
        this.encoding = b.encoding;
        this.tagAttributeKeys = List.copyOf(b.tagAttributeKeys);
        this.supportsFromToId = b.supportsFromToId;
        this.attributePriority = Map.copyOf(b.attributePriority);
    }

    public static ItemsXmlWriteOptions defaults() {
        return builder().build();
    }

    /**
     * Options taken from {@code schema}. Empty tag key lists and priority maps keep the defaults.
     */
    public static ItemsXmlWriteOptions forSchema(AttributeSchema schema) {
        Objects.requireNonNull(schema, "schema");
        Builder b = builder()
                .encoding(schema.itemsXmlEncoding())
                .supportsFromToId(schema.fromToIdSupported())
                .attributePriority(schema.attributePriority());
        List<String> tags = schema.tagAttributeKeys();
        if (!tags.isEmpty()) {
            b.tagAttributeKeys(tags);
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String encoding() {
        return encoding;
    }

    /**
     * Keys written on the {@code <item>} tag, in output order.
     */
    public List<String> tagAttributeKeys() {
        return tagAttributeKeys;
    }

    public boolean supportsFromToId() {
        return supportsFromToId;
    }

    /**
     * {@code key -> order}; lower orders are written first, unlisted keys after them alphabetically.
     */
    public Map<String, Integer> attributePriority() {
        return attributePriority;
    }

    public static final class Builder {
        private String encoding = DEFAULT_ENCODING;
        private List<String> tagAttributeKeys = DEFAULT_TAG_ATTRIBUTE_KEYS;
        private boolean supportsFromToId = true;
        private Map<String, Integer> attributePriority = Map.of();

        private Builder() {
        }

        public Builder encoding(String encoding) {
            this.encoding = Objects.requireNonNull(encoding, "encoding");
            return this;
        }

        public Builder tagAttributeKeys(List<String> tagAttributeKeys) {
            this.tagAttributeKeys = Objects.requireNonNull(tagAttributeKeys, "tagAttributeKeys");
            return this;
        }

        public Builder supportsFromToId(boolean supportsFromToId) {
            this.supportsFromToId = supportsFromToId;
            return this;
        }

        public Builder attributePriority(Map<String, Integer> attributePriority) {
            this.attributePriority = Objects.requireNonNull(attributePriority, "attributePriority");
            return this;
        }

        public ItemsXmlWriteOptions build() {
            return new ItemsXmlWriteOptions(this);
        }
    }
}
