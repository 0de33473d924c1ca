package io.serveritems.xml;

import java.util.List;

/**
 * Outcome of an items.xml read.
 *
 * @param success false when the document was not well-formed; nothing was applied in that case
 * @param missingAttributes nested attribute keys unknown to the schema, sorted and distinct
 * @param missingTagAttributes item tag attributes outside the known tag set, sorted and distinct
 */
public record ItemsXmlReadResult(boolean success, List<String> missingAttributes, List<String> missingTagAttributes) {

    public ItemsXmlReadResult {
        missingAttributes = List.copyOf(missingAttributes);
        missingTagAttributes = List.copyOf(missingTagAttributes);
    }

    public static ItemsXmlReadResult failure() {
        return new ItemsXmlReadResult(false, List.of(), List.of());
    }
}
