package io.serveritems.service;

import io.serveritems.attributes.AttributeSchemaRegistry;

/**
 * Settings of a {@link ServerItemsService}.
 */
public final class ServerItemsConfig {
    public static final int DEFAULT_SPRITE_CACHE_SIZE = 4096;

    private static final ServerItemsConfig DEFAULTS = builder().build();

    private final String defaultAttributeServer;
    private final int clientVersion;
    private final int spriteCacheSize;
    private final boolean transparent;

    private ServerItemsConfig(Builder builder) {
        this.defaultAttributeServer = builder.defaultAttributeServer;
        this.clientVersion = builder.clientVersion;
        this.spriteCacheSize = builder.spriteCacheSize;
        this.transparent = builder.transparent;
    }

    public static ServerItemsConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Attribute server used when a load request names none; null disables attribute validation.
     */
    public String defaultAttributeServer() {
        return defaultAttributeServer;
    }

    /**
     * Client version for sync gating; 0 means use the version stored in the loaded OTB file.
     */
    public int clientVersion() {
        return clientVersion;
    }

    public int spriteCacheSize() {
        return spriteCacheSize;
    }

    public boolean transparent() {
        return transparent;
    }

    public static final class Builder {
        private String defaultAttributeServer = AttributeSchemaRegistry.DEFAULT_SERVER;
        private int clientVersion;
        private int spriteCacheSize = DEFAULT_SPRITE_CACHE_SIZE;
        private boolean transparent;

        private Builder() {
        }

        public Builder defaultAttributeServer(String defaultAttributeServer) {
            this.defaultAttributeServer = defaultAttributeServer;
            return this;
        }

        public Builder clientVersion(int clientVersion) {
            if (clientVersion < 0) {
                throw new IllegalArgumentException("clientVersion must be non-negative");
            }
            this.clientVersion = clientVersion;
            return this;
        }

        public Builder spriteCacheSize(int spriteCacheSize) {
            if (spriteCacheSize <= 0) {
                throw new IllegalArgumentException("spriteCacheSize must be positive");
            }
            this.spriteCacheSize = spriteCacheSize;
            return this;
        }

        public Builder transparent(boolean transparent) {
            this.transparent = transparent;
            return this;
        }

        public ServerItemsConfig build() {
            return new ServerItemsConfig(this);
        }
    }
}
