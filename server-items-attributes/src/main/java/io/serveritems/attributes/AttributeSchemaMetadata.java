package io.serveritems.attributes;

public record AttributeSchemaMetadata(String server, String displayName, boolean supportsFromToId, String itemsXmlEncoding) {
}
