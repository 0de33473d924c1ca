package io.serveritems.service;

import io.serveritems.attributes.AttributeSchema;
import io.serveritems.attributes.AttributeSchemaRegistry;
import io.serveritems.core.ServerItem;
import io.serveritems.core.ServerItemList;
import io.serveritems.core.ServerItemType;
import io.serveritems.core.ServerItemsException;
import io.serveritems.otb.OtbReader;
import io.serveritems.otb.OtbWriter;
import io.serveritems.sync.CachingSpritePixelProvider;
import io.serveritems.sync.OtbSync;
import io.serveritems.sync.SpritePixelProvider;
import io.serveritems.sync.SyncOptions;
import io.serveritems.sync.ThingType;
import io.serveritems.xml.ItemsXmlReadOptions;
import io.serveritems.xml.ItemsXmlReadResult;
import io.serveritems.xml.ItemsXmlReader;
import io.serveritems.xml.ItemsXmlWriteOptions;
import io.serveritems.xml.ItemsXmlWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One editing session over a server item database.
 *
 * <p>Holds at most one loaded {@link ServerItemList}. A load replaces the session only once the OTB file and
 * the optional items.xml have both been parsed. Instances are not thread-safe; callers serialize access.
 */
public final class ServerItemsService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ServerItemsService.class);

    static final String NOT_LOADED_MESSAGE = "No server items loaded";

    private final ServerItemsConfig config;
    private final AttributeSchemaRegistry schemas;
    private final ItemsXmlReader xmlReader = new ItemsXmlReader();

    private ServerItemList itemList;
    private String attributeServer;
    private SpritePixelProvider pixelProvider;

    public ServerItemsService() {
        this(ServerItemsConfig.defaults(), AttributeSchemaRegistry.defaultRegistry());
    }

    public ServerItemsService(ServerItemsConfig config, AttributeSchemaRegistry schemas) {
        this.config = Objects.requireNonNull(config, "config");
        this.schemas = Objects.requireNonNull(schemas, "schemas");
    }

    /**
     * Parses the OTB buffer and, when present, applies the items.xml content to the parsed items.
     *
     * @throws ServerItemsException.MalformedNodeStream if the OTB node stream is broken
     * @throws ServerItemsException.InvalidVersionHeader if the OTB root version attribute has the wrong size
     */
    public LoadResult load(LoadRequest request) {
        Objects.requireNonNull(request, "request");
        ServerItemList loaded = OtbReader.read(request.otbBuffer());

        String server = request.attributeServer() != null
                ? request.attributeServer()
                : config.defaultAttributeServer();
        AttributeSchema schema = server == null ? null : schemas.find(server).orElse(null);

        List<String> missingAttributes = List.of();
        List<String> missingTagAttributes = List.of();
        String xml = request.xmlContent();
        if (xml != null && !xml.isEmpty()) {
            ItemsXmlReadOptions options = schema != null
                    ? ItemsXmlReadOptions.forSchema(schema)
                    : ItemsXmlReadOptions.defaults();
            ItemsXmlReadResult xmlResult = xmlReader.read(xml, loaded, options);
            if (!xmlResult.success()) {
                LOGGER.warn("items.xml could not be parsed, keeping the previous session");
                return LoadResult.failure();
            }
            missingAttributes = xmlResult.missingAttributes();
            missingTagAttributes = xmlResult.missingTagAttributes();
        }

        unload();
        itemList = loaded;
        attributeServer = server;
        selectServer(server);
        LOGGER.info("Loaded {} server items (OTB {}.{}.{}, client {}), attribute server {}",
                loaded.size(), loaded.majorVersion(), loaded.minorVersion(), loaded.buildNumber(),
                loaded.clientVersion(), server);
        if (!missingAttributes.isEmpty() || !missingTagAttributes.isEmpty()) {
            LOGGER.info("items.xml uses {} unknown attributes and {} unknown tag attributes",
                    missingAttributes.size(), missingTagAttributes.size());
        }
        return new LoadResult(true, loaded, missingAttributes, missingTagAttributes);
    }

    /**
     * Serializes the loaded items to OTB and items.xml, using the layout of the active attribute server.
     *
     * @throws ServerItemsException.NotLoaded if nothing is loaded
     */
    public SaveResult save() {
        ServerItemList items = requireLoaded();
        AttributeSchema schema = attributeServer == null ? null : schemas.find(attributeServer).orElse(null);
        ItemsXmlWriteOptions options = schema != null
                ? ItemsXmlWriteOptions.forSchema(schema)
                : ItemsXmlWriteOptions.defaults();

        byte[] otb = OtbWriter.write(items);
        String xml = ItemsXmlWriter.write(items, options);
        LOGGER.info("Saved {} server items ({} bytes OTB)", items.size(), otb.length);
        return new SaveResult(otb, xml, options.encoding());
    }

    /**
     * Updates the item with {@code serverId} from {@code thing}, keeping its type.
     *
     * @return false if nothing is loaded or no such item exists
     */
    public boolean syncItem(int serverId, ThingType thing) {
        Objects.requireNonNull(thing, "thing");
        if (itemList == null) return false;
        ServerItem item = itemList.getById(serverId);
        if (item == null) return false;
        OtbSync.syncFromThingType(item, thing, syncOptions());
        return true;
    }

    /**
     * Updates every non-deprecated item whose client id matches one of {@code things}.
     *
     * @return number of items updated
     */
    public int syncAllItems(Iterable<ThingType> things) {
        Objects.requireNonNull(things, "things");
        if (itemList == null) return 0;
        SyncOptions options = syncOptions();
        int synced = 0;
        for (ThingType thing : things) {
            for (ServerItem item : itemList.getByClientId(thing.id())) {
                if (item.type() == ServerItemType.DEPRECATED) continue;
                OtbSync.syncFromThingType(item, thing, options);
                synced++;
            }
        }
        LOGGER.info("Synced {} server items", synced);
        return synced;
    }

    /**
     * Adds an item for each thing whose client id no server item references yet. New items take consecutive
     * ids after the current highest one.
     *
     * @return number of items created
     */
    public int createMissingItems(Iterable<ThingType> things) {
        Objects.requireNonNull(things, "things");
        if (itemList == null) return 0;
        SyncOptions options = syncOptions();
        int created = 0;
        for (ThingType thing : things) {
            if (itemList.hasClientId(thing.id())) continue;
            itemList.add(OtbSync.createFromThingType(thing, itemList.maxId() + 1, options));
            created++;
        }
        LOGGER.info("Created {} server items", created);
        return created;
    }

    /**
     * Ids of non-deprecated items whose flags no longer match the thing with their client id.
     */
    public List<Integer> findOutOfSyncItems(Iterable<ThingType> things) {
        Objects.requireNonNull(things, "things");
        List<Integer> outOfSync = new ArrayList<>();
        if (itemList == null) return outOfSync;
        for (ThingType thing : things) {
            for (ServerItem item : itemList.getByClientId(thing.id())) {
                if (item.type() != ServerItemType.DEPRECATED
                        && !OtbSync.flagsMatch(item, thing, clientVersion())) {
                    outOfSync.add(item.id());
                }
            }
        }
        return outOfSync;
    }

    public Optional<ServerItem> getItem(int serverId) {
        return itemList == null ? Optional.empty() : Optional.ofNullable(itemList.getById(serverId));
    }

    public List<ServerItem> getItemsByClientId(int clientId) {
        return itemList == null ? List.of() : itemList.getByClientId(clientId);
    }

    public Optional<ServerItem> getFirstItemByClientId(int clientId) {
        return itemList == null ? Optional.empty() : Optional.ofNullable(itemList.getFirstByClientId(clientId));
    }

    /**
     * Switches the attribute server used by the next save.
     */
    public void setAttributeServer(String server) {
        Objects.requireNonNull(server, "server");
        attributeServer = server;
        selectServer(server);
    }

    /**
     * Sets the source of sprite pixels for hash computation; null stops sprite hashing.
     * Lookups are cached up to {@link ServerItemsConfig#spriteCacheSize()} sprites.
     */
    public void setPixelProvider(SpritePixelProvider provider) {
        pixelProvider = provider == null ? null : new CachingSpritePixelProvider(provider, config.spriteCacheSize());
    }

    /**
     * Drops the loaded items and the attribute server selection.
     */
    public void unload() {
        if (itemList != null) {
            itemList.clear();
            LOGGER.debug("Unloaded server items");
        }
        itemList = null;
        attributeServer = null;
    }

    public boolean isLoaded() {
        return itemList != null;
    }

    /**
     * The loaded items, or null if nothing is loaded.
     */
    public ServerItemList itemList() {
        return itemList;
    }

    public String attributeServerName() {
        return attributeServer;
    }

    public ServerItemsConfig config() {
        return config;
    }

    private ServerItemList requireLoaded() {
        if (itemList == null) {
            throw new ServerItemsException.NotLoaded(NOT_LOADED_MESSAGE);
        }
        return itemList;
    }

    private void selectServer(String server) {
        if (server != null) {
            schemas.loadServer(server);
        }
    }

    /**
     * Client version used for flag gating: the configured one, or the version in the loaded OTB header when
     * none is configured.
     */
    public int clientVersion() {
        if (config.clientVersion() != 0 || itemList == null) {
            return config.clientVersion();
        }
        return itemList.clientVersion();
    }

    private SyncOptions syncOptions() {
        return SyncOptions.builder()
                .clientVersion(clientVersion())
                .pixelProvider(pixelProvider)
                .transparent(config.transparent())
                .build();
    }
}
