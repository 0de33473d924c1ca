package io.serveritems.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Value of an items.xml attribute attached to a {@link ServerItem}.
 *
 * <p>Plain {@code key/value} attributes are {@link Leaf}s. An {@code <attribute>} element with
 * {@code <attribute>} children is a {@link Nested} record: the outer element's own value plus its children.
 */
public sealed interface XmlAttributeValue permits XmlAttributeValue.Leaf, XmlAttributeValue.Nested {

    /**
     * Key under which a nested record's own value is exposed by {@link Nested#asMap()}.
     */
    String PARENT_VALUE_KEY = "_parentValue";

    static Leaf of(String value) {
        return new Leaf(value);
    }

    record Leaf(String value) implements XmlAttributeValue {
        public Leaf {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * @param parentValue the outer element's {@code value}; null or empty means it had none
     * @param children child {@code key -> value} pairs
     */
    record Nested(String parentValue, Map<String, String> children) implements XmlAttributeValue {
        public Nested {
            Objects.requireNonNull(children, "children");
            if (parentValue != null && parentValue.isEmpty()) {
                parentValue = null;
            }
            children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
        }

        public boolean hasParentValue() {
            return parentValue != null;
        }

        /**
         * Flat view with the parent value stored under {@link #PARENT_VALUE_KEY}.
         */
        public Map<String, String> asMap() {
            Map<String, String> out = new LinkedHashMap<>();
            if (hasParentValue()) {
                out.put(PARENT_VALUE_KEY, parentValue);
            }
            out.putAll(children);
            return out;
        }
    }
}
