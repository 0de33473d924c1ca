package io.serveritems.xml;

import com.fasterxml.jackson.dataformat.xml.XmlFactory;
import io.serveritems.core.ServerItem;
import io.serveritems.core.ServerItemList;
import io.serveritems.core.XmlAttributeValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Applies items.xml content to the items of a {@link ServerItemList}.
 *
 * <p>The document is parsed completely before any item is touched, so malformed XML changes nothing and
 * yields {@link ItemsXmlReadResult#failure()}. Elements naming ids absent from the list are skipped.
 */
public final class ItemsXmlReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(ItemsXmlReader.class);

    private static final Set<String> RESERVED = Set.of("id", "fromid", "toid");

    private final XMLInputFactory inputFactory;

    public ItemsXmlReader() {
        XMLInputFactory f = new XmlFactory().getXMLInputFactory();
        f.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        f.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        this.inputFactory = f;
    }

    public ItemsXmlReadResult read(String xml, ServerItemList items) {
        return read(xml, items, ItemsXmlReadOptions.defaults());
    }

    public ItemsXmlReadResult read(String xml, ServerItemList items, ItemsXmlReadOptions options) {
        Objects.requireNonNull(xml, "xml");
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(options, "options");

        List<ItemElement> elements;
        try {
            elements = parse(xml);
        } catch (XMLStreamException | RuntimeException e) {
            LOGGER.warn("Failed to parse items.xml: {}", e.getMessage());
            return ItemsXmlReadResult.failure();
        }

        // first spelling of each nested key wins
        Set<String> missingAttributes = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        Set<String> missingTagAttributes = new TreeSet<>();
        int applied = 0;
        for (ItemElement element : elements) {
            int[] range = element.idRange();
            if (range == null || items.isEmpty()) continue;
            // ids outside the list can never match
            int from = Math.max(range[0], items.minId());
            int to = Math.min(range[1], items.maxId());
            for (int id = from; id <= to; id++) {
                ServerItem item = items.getById(id);
                if (item == null) continue;
                apply(element, item, options, missingAttributes, missingTagAttributes);
                applied++;
            }
        }

        LOGGER.debug("Applied {} items.xml elements to {} items", elements.size(), applied);
        return new ItemsXmlReadResult(true, new ArrayList<>(missingAttributes), new ArrayList<>(missingTagAttributes));
    }

    private static void apply(ItemElement element, ServerItem item, ItemsXmlReadOptions options,
                              Set<String> missingAttributes, Set<String> missingTagAttributes) {
        for (Map.Entry<String, String> tag : element.tagAttributes().entrySet()) {
            if (!options.isKnownTagAttribute(tag.getKey())) {
                missingTagAttributes.add(tag.getKey());
            }
            item.setXmlAttribute(tag.getKey(), tag.getValue());
        }
        for (AttributeElement attribute : element.attributes()) {
            item.setXmlAttribute(attribute.key(), attribute.toValue());
            if (!options.isKnownAttribute(attribute.key())) {
                missingAttributes.add(attribute.key());
            }
        }
    }

    // parsing

    private List<ItemElement> parse(String xml) throws XMLStreamException {
        XMLStreamReader r = inputFactory.createXMLStreamReader(new StringReader(xml));
        try {
            List<ItemElement> out = new ArrayList<>();
            r.nextTag(); // root element, name not checked
            while (nextChildElement(r)) {
                if ("item".equals(r.getLocalName())) {
                    out.add(readItem(r));
                } else {
                    skipElement(r);
                }
            }
            // drain to the end so trailing garbage is reported as malformed
            while (r.hasNext()) {
                r.next();
            }
            return out;
        } finally {
            r.close();
        }
    }

    private static ItemElement readItem(XMLStreamReader r) throws XMLStreamException {
        String id = null;
        String fromId = null;
        String toId = null;
        Map<String, String> tagAttributes = new LinkedHashMap<>();
        for (int i = 0; i < r.getAttributeCount(); i++) {
            String name = r.getAttributeLocalName(i);
            String value = r.getAttributeValue(i);
            if ("id".equals(name)) id = value;
            else if ("fromid".equals(name)) fromId = value;
            else if ("toid".equals(name)) toId = value;
            if (!RESERVED.contains(name)) {
                tagAttributes.put(name, value);
            }
        }

        List<AttributeElement> attributes = new ArrayList<>();
        while (nextChildElement(r)) {
            if ("attribute".equals(r.getLocalName())) {
                AttributeElement a = readAttribute(r, true);
                if (a != null) attributes.add(a);
            } else {
                skipElement(r);
            }
        }
        return new ItemElement(id, fromId, toId, tagAttributes, attributes);
    }

    private static AttributeElement readAttribute(XMLStreamReader r, boolean allowChildren) throws XMLStreamException {
        String key = r.getAttributeValue(null, "key");
        String value = r.getAttributeValue(null, "value");
        List<AttributeElement> children = new ArrayList<>();
        while (nextChildElement(r)) {
            if (allowChildren && "attribute".equals(r.getLocalName())) {
                AttributeElement child = readAttribute(r, false);
                if (child != null) children.add(child);
            } else {
                skipElement(r);
            }
        }
        if (key == null || key.isEmpty()) return null;
        return new AttributeElement(key, value, children);
    }

    /**
     * Advances to the next child start element of the current element. Returns false, positioned on the
     * current element's end tag, when there are no more children.
     */
    private static boolean nextChildElement(XMLStreamReader r) throws XMLStreamException {
        while (r.hasNext()) {
            int event = r.next();
            if (event == XMLStreamConstants.START_ELEMENT) return true;
            if (event == XMLStreamConstants.END_ELEMENT) return false;
        }
        throw new XMLStreamException("Unexpected end of document");
    }

    private static void skipElement(XMLStreamReader r) throws XMLStreamException {
        while (nextChildElement(r)) {
            skipElement(r);
        }
    }

    // intermediate form

    private record ItemElement(String id, String fromId, String toId,
                               Map<String, String> tagAttributes, List<AttributeElement> attributes) {

        /**
         * Inclusive {@code [from, to]} id range this element targets, or null when the id attributes are
         * missing or unparsable. A single {@code id} wins over {@code fromid/toid}.
         */
        int[] idRange() {
            if (id != null && !id.isEmpty()) {
                Integer single = parseId(id);
                return single == null ? null : new int[] {single, single};
            }
            if (fromId != null && !fromId.isEmpty() && toId != null && !toId.isEmpty()) {
                Integer from = parseId(fromId);
                Integer to = parseId(toId);
                return from == null || to == null ? null : new int[] {from, to};
            }
            return null;
        }

        private static Integer parseId(String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                LOGGER.debug("Ignoring items.xml element with invalid id '{}'", s);
                return null;
            }
        }
    }

    private record AttributeElement(String key, String value, List<AttributeElement> children) {

        XmlAttributeValue toValue() {
            if (children.isEmpty()) {
                return XmlAttributeValue.of(value == null ? "" : value);
            }
            Map<String, String> nested = new LinkedHashMap<>();
            for (AttributeElement child : children) {
                nested.put(child.key(), child.value() == null ? "" : child.value());
            }
            return new XmlAttributeValue.Nested(value, nested);
        }
    }
}
