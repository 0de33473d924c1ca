package io.serveritems.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * All server items of one loaded database plus the OTB header versions.
 *
 * <p>Items are indexed by server id (unique) and by client id (one to many, insertion order).
 * Both indices are updated on every add and remove.
 */
public final class ServerItemList {
    private static final Logger LOGGER = LoggerFactory.getLogger(ServerItemList.class);

    /** Reported by {@link #minId()} and {@link #maxId()} while the list is empty. */
    public static final int EMPTY_BOUNDARY_ID = 100;

    private int majorVersion;
    private int minorVersion;
    private int buildNumber;
    private int clientVersion;

    private final NavigableMap<Integer, ServerItem> byId = new TreeMap<>();
    private final Map<Integer, List<ServerItem>> byClientId = new HashMap<>();

    public int majorVersion() {
        return majorVersion;
    }

    public void setMajorVersion(int majorVersion) {
        this.majorVersion = majorVersion;
    }

    public int minorVersion() {
        return minorVersion;
    }

    public void setMinorVersion(int minorVersion) {
        this.minorVersion = minorVersion;
    }

    public int buildNumber() {
        return buildNumber;
    }

    public void setBuildNumber(int buildNumber) {
        this.buildNumber = buildNumber;
    }

    /**
     * Client version in {@code major * 100 + minor} form, e.g. 1098.
     */
    public int clientVersion() {
        return clientVersion;
    }

    public void setClientVersion(int clientVersion) {
        this.clientVersion = clientVersion;
    }

    public int size() {
        return byId.size();
    }

    public boolean isEmpty() {
        return byId.isEmpty();
    }

    public int minId() {
        return byId.isEmpty() ? EMPTY_BOUNDARY_ID : byId.firstKey();
    }

    public int maxId() {
        return byId.isEmpty() ? EMPTY_BOUNDARY_ID : byId.lastKey();
    }

    /**
     * Adds an item. An item already stored under the same id is replaced and unlinked from the client id index.
     */
    public void add(ServerItem item) {
        Objects.requireNonNull(item, "item");
        ServerItem previous = byId.put(item.id(), item);
        if (previous == item) return;
        if (previous != null) {
            LOGGER.debug("Replacing server item {} (client id {})", previous.id(), previous.clientId());
            unlinkClientId(previous);
        }
        byClientId.computeIfAbsent(item.clientId(), k -> new ArrayList<>()).add(item);
    }

    public ServerItem getById(int id) {
        return byId.get(id);
    }

    public boolean hasId(int id) {
        return byId.containsKey(id);
    }

    /**
     * All items sharing a client id, in insertion order. Never null.
     */
    public List<ServerItem> getByClientId(int clientId) {
        List<ServerItem> items = byClientId.get(clientId);
        return items == null ? List.of() : Collections.unmodifiableList(items);
    }

    public ServerItem getFirstByClientId(int clientId) {
        List<ServerItem> items = byClientId.get(clientId);
        return items == null ? null : items.get(0);
    }

    public boolean hasClientId(int clientId) {
        return byClientId.containsKey(clientId);
    }

    /**
     * Removes the item with the given id.
     *
     * @return true if an item was removed
     */
    public boolean removeById(int id) {
        ServerItem removed = byId.remove(id);
        if (removed == null) return false;
        unlinkClientId(removed);
        return true;
    }

    public void clear() {
        byId.clear();
        byClientId.clear();
    }

    /**
     * Items sorted ascending by id.
     */
    public List<ServerItem> toArray() {
        return new ArrayList<>(byId.values());
    }

    public int maxClientId() {
        int max = 0;
        for (ServerItem item : byId.values()) {
            if (item.clientId() > max) max = item.clientId();
        }
        return max;
    }

    /**
     * Creates an item for every client id above the current highest one, up to {@code maxClientId} inclusive.
     * New items take consecutive ids after {@link #maxId()} and carry an all-zero sprite hash.
     *
     * @return number of items created
     */
    public int createMissingItems(int maxClientId) {
        int lastClientId = maxClientId();
        int created = 0;
        for (int clientId = lastClientId + 1; clientId <= maxClientId; clientId++) {
            ServerItem item = new ServerItem(maxId() + 1, clientId);
            item.setSpriteHash(ServerItem.emptySpriteHash());
            add(item);
            created++;
        }
        return created;
    }

    private void unlinkClientId(ServerItem item) {
        List<ServerItem> items = byClientId.get(item.clientId());
        if (items == null) return;
        items.remove(item);
        if (items.isEmpty()) {
            byClientId.remove(item.clientId());
        }
    }
}
