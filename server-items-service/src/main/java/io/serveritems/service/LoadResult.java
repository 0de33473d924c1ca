package io.serveritems.service;

import io.serveritems.core.ServerItemList;

import java.util.List;

/**
 * Outcome of a load.
 *
 * @param success false when the items.xml content could not be parsed; the previous session is then kept
 * @param itemList the loaded items, or null when {@code success} is false
 * @param missingAttributes nested attribute keys found in items.xml but unknown to the attribute server
 * @param missingTagAttributes tag attribute keys found in items.xml but unknown to the attribute server
 */
public record LoadResult(
        boolean success,
        ServerItemList itemList,
        List<String> missingAttributes,
        List<String> missingTagAttributes) {

    public LoadResult {
        missingAttributes = List.copyOf(missingAttributes);
        missingTagAttributes = List.copyOf(missingTagAttributes);
    }

    static LoadResult failure() {
        return new LoadResult(false, null, List.of(), List.of());
    }

    public boolean hasMissingAttributes() {
        return !missingAttributes.isEmpty() || !missingTagAttributes.isEmpty();
    }
}
