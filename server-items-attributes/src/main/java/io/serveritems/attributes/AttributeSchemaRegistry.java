package io.serveritems.attributes;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.serveritems.core.ServerItemsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Lookup of attribute schemas by server name, with a "current server" selector.
 *
 * <p>Schemas never change after construction; {@link #loadServer} only moves the selector.
 * Codecs take an {@link AttributeSchema} argument and do not read the selector.
 */
public final class AttributeSchemaRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(AttributeSchemaRegistry.class);

    public static final String DEFAULT_SERVER = "tfs1.4";

    static final List<String> BUNDLED_SERVERS = List.of(
            "tfs0.3.6", "tfs0.4", "tfs0.5", "tfs1.0", "tfs1.1", "tfs1.2", "tfs1.4", "tfs1.6");

    private static final String RESOURCE_DIR = "io/serveritems/attributes/";

    /**
     * Server id paired with its display name.
     */
    public record ServerLabel(String server, String displayName) {
    }

    private final Map<String, AttributeSchema> byServer;
    private String currentServer;

    public AttributeSchemaRegistry(Collection<AttributeSchema> schemas) {
        Objects.requireNonNull(schemas, "schemas");
        Map<String, AttributeSchema> map = new TreeMap<>();
        for (AttributeSchema s : schemas) {
            map.put(s.server(), s);
        }
        this.byServer = Map.copyOf(map);
    }

    /**
     * Registry of the bundled TFS schemas.
     */
    public static AttributeSchemaRegistry defaultRegistry() {
        return load(AttributeSchemaRegistry.class.getClassLoader(), BUNDLED_SERVERS);
    }

    static AttributeSchemaRegistry load(ClassLoader cl, List<String> servers) {
        Objects.requireNonNull(cl, "cl");
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        List<AttributeSchema> schemas = new ArrayList<>();
        for (String server : servers) {
            String resource = RESOURCE_DIR + server + ".json";
            try (InputStream in = cl.getResourceAsStream(resource)) {
                if (in == null) {
                    throw new ServerItemsException.SchemaUnavailable("Missing attribute schema resource " + resource, null);
                }
                schemas.add(mapper.readValue(in, AttributeSchema.class));
            } catch (IOException e) {
                throw new ServerItemsException.SchemaUnavailable("Failed to read attribute schema " + resource, e);
            }
        }
        LOGGER.debug("Loaded {} attribute schemas", schemas.size());
        return new AttributeSchemaRegistry(schemas);
    }

    /**
     * Server ids, sorted.
     */
    public List<String> availableServers() {
        return List.copyOf(byServer.keySet());
    }

    public List<ServerLabel> availableServersWithLabels() {
        List<ServerLabel> out = new ArrayList<>();
        for (String server : byServer.keySet()) {
            out.add(new ServerLabel(server, displayName(server)));
        }
        return out;
    }

    public Optional<AttributeSchema> find(String server) {
        if (server == null) return Optional.empty();
        return Optional.ofNullable(byServer.get(server));
    }

    /**
     * Selects {@code server} as current and returns its attributes, or null for an unknown name.
     * An unknown name leaves the selection unchanged.
     */
    public List<ItemAttribute> loadServer(String server) {
        AttributeSchema schema = byServer.get(server);
        if (schema == null) {
            LOGGER.warn("Unknown attribute server '{}'", server);
            return null;
        }
        currentServer = server;
        return schema.attributes();
    }

    public String currentServer() {
        return currentServer;
    }

    public Optional<AttributeSchema> current() {
        return find(currentServer);
    }

    /**
     * Attributes of the current server, or null if none is selected.
     */
    public List<ItemAttribute> attributes() {
        return current().map(AttributeSchema::attributes).orElse(null);
    }

    public String displayName(String server) {
        return find(server).map(AttributeSchema::displayName).orElse(server);
    }

    /**
     * Range support of {@code server}, or of the current server when null. Unknown servers report true.
     */
    public boolean supportsFromToId(String server) {
        return find(server == null ? currentServer : server).map(AttributeSchema::fromToIdSupported).orElse(true);
    }

    public boolean supportsFromToId() {
        return supportsFromToId(null);
    }

    /**
     * items.xml encoding of {@code server}, or of the current server when null. Unknown servers report iso-8859-1.
     */
    public String itemsXmlEncoding(String server) {
        return find(server == null ? currentServer : server)
                .map(AttributeSchema::itemsXmlEncoding)
                .orElse(AttributeSchema.DEFAULT_ENCODING);
    }

    public String itemsXmlEncoding() {
        return itemsXmlEncoding(null);
    }

    public Optional<AttributeSchemaMetadata> metadata(String server) {
        return find(server).map(AttributeSchema::metadata);
    }

    // queries over the current server; empty when none is selected

    public List<String> categories() {
        return current().map(AttributeSchema::categories).orElse(List.of());
    }

    public List<ItemAttribute> attributesByCategory(String category) {
        return current().map(s -> s.attributesByCategory(category)).orElse(List.of());
    }

    public List<String> attributeKeysInOrder() {
        return current().map(AttributeSchema::attributeKeysInOrder).orElse(List.of());
    }

    public List<String> tagAttributeKeys() {
        return current().map(AttributeSchema::tagAttributeKeys).orElse(List.of());
    }

    public Map<String, Integer> attributePriority() {
        return current().map(AttributeSchema::attributePriority).orElse(Map.of());
    }

    public List<ItemAttribute> searchAttributes(String keyword) {
        return current().map(s -> s.searchAttributes(keyword)).orElse(List.of());
    }

    /**
     * Clears the current server selection.
     */
    public void reset() {
        currentServer = null;
    }
}
