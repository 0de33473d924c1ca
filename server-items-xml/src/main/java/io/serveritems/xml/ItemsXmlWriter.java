package io.serveritems.xml;

import io.serveritems.core.ServerItem;
import io.serveritems.core.ServerItemList;
import io.serveritems.core.XmlAttributeValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Renders the xml attributes of a {@link ServerItemList} as items.xml text.
 *
 * <p>Only items with xml data are written, in ascending id order. Runs of consecutive ids with equal
 * attributes collapse into one {@code fromid/toid} element when the options allow it.
 */
public final class ItemsXmlWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ItemsXmlWriter.class);

    private static final Comparator<String> ALPHABETICAL =
            String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder());

    private ItemsXmlWriter() {
    }

    public static String write(ServerItemList items) {
        return write(items, ItemsXmlWriteOptions.defaults());
    }

    public static String write(ServerItemList items, ItemsXmlWriteOptions options) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(options, "options");

        Set<String> tagKeys = new HashSet<>(options.tagAttributeKeys());
        StringBuilder out = new StringBuilder();
        out.append("<?xml version=\"1.0\" encoding=\"").append(options.encoding()).append("\"?>\n");
        out.append("<items>\n");

        List<ServerItem> sorted = items.toArray();
        int elements = 0;
        int i = 0;
        while (i < sorted.size()) {
            ServerItem item = sorted.get(i);
            if (!item.hasXmlData()) {
                i++;
                continue;
            }
            int end = options.supportsFromToId() ? rangeEnd(sorted, i) : i;
            writeItem(out, item, sorted.get(end), options, tagKeys);
            elements++;
            i = end + 1;
        }

        out.append("</items>\n");
        LOGGER.debug("Wrote {} items.xml elements", elements);
        return out.toString();
    }

    private static int rangeEnd(List<ServerItem> sorted, int start) {
        ServerItem first = sorted.get(start);
        int end = start;
        for (int i = start + 1; i < sorted.size(); i++) {
            ServerItem next = sorted.get(i);
            if (next.id() != sorted.get(i - 1).id() + 1) break;
            if (!first.xmlAttributes().equals(next.xmlAttributes())) break;
            end = i;
        }
        return end;
    }

    private static void writeItem(StringBuilder out, ServerItem item, ServerItem last,
                                  ItemsXmlWriteOptions options, Set<String> tagKeys) {
        out.append("\t<item");
        if (last.id() != item.id()) {
            out.append(" fromid=\"").append(item.id()).append("\" toid=\"").append(last.id()).append('"');
        } else {
            out.append(" id=\"").append(item.id()).append('"');
        }

        for (String key : options.tagAttributeKeys()) {
            String value = item.xmlAttributeString(key);
            if (value != null && (!value.isEmpty() || "name".equals(key))) {
                out.append(' ').append(key).append("=\"").append(XmlText.escape(value)).append('"');
            }
        }

        List<String> nestedKeys = nestedKeys(item.xmlAttributes(), tagKeys, options.attributePriority());
        if (nestedKeys.isEmpty()) {
            out.append(" />\n");
            return;
        }
        out.append(">\n");
        for (String key : nestedKeys) {
            writeAttribute(out, key, item.xmlAttribute(key), 2);
        }
        out.append("\t</item>\n");
    }

    private static List<String> nestedKeys(Map<String, XmlAttributeValue> attrs, Set<String> tagKeys,
                                           Map<String, Integer> priority) {
        List<String> keys = new ArrayList<>();
        for (String key : attrs.keySet()) {
            if (!tagKeys.contains(key) && !XmlAttributeValue.PARENT_VALUE_KEY.equals(key)) {
                keys.add(key);
            }
        }
        keys.sort(Comparator.<String>comparingInt(k -> priority.getOrDefault(k, Integer.MAX_VALUE))
                .thenComparing(ALPHABETICAL));
        return keys;
    }

    private static void writeAttribute(StringBuilder out, String key, XmlAttributeValue value, int depth) {
        String indent = "\t".repeat(depth);
        if (value instanceof XmlAttributeValue.Leaf) {
            out.append(indent).append("<attribute key=\"").append(XmlText.escape(key))
                    .append("\" value=\"").append(XmlText.escape(((XmlAttributeValue.Leaf) value).value()))
                    .append("\" />\n");
            return;
        }
        XmlAttributeValue.Nested nested = (XmlAttributeValue.Nested) value;
        out.append(indent).append("<attribute key=\"").append(XmlText.escape(key)).append('"');
        if (nested.hasParentValue()) {
            out.append(" value=\"").append(XmlText.escape(nested.parentValue())).append('"');
        }
        out.append(">\n");
        String childIndent = "\t".repeat(depth + 1);
        for (Map.Entry<String, String> child : new TreeMap<>(nested.children()).entrySet()) {
            if (XmlAttributeValue.PARENT_VALUE_KEY.equals(child.getKey())) continue;
            out.append(childIndent).append("<attribute key=\"").append(XmlText.escape(child.getKey()))
                    .append("\" value=\"").append(XmlText.escape(child.getValue())).append("\" />\n");
        }
        out.append(indent).append("</attribute>\n");
    }
}
