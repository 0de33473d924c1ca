package io.serveritems.sync;

/**
 * Options for projecting a thing type onto a server item.
 */
public final class SyncOptions {
    private static final SyncOptions DEFAULTS = builder().build();

    private final boolean syncType;
    private final int clientVersion;
    private final SpritePixelProvider pixelProvider;
    private final boolean transparent;

    private SyncOptions(Builder builder) {
        this.syncType = builder.syncType;
        this.clientVersion = builder.clientVersion;
        this.pixelProvider = builder.pixelProvider;
        this.transparent = builder.transparent;
    }

    /**
     * Type sync off, client version 0, no sprite hashing.
     */
    public static SyncOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean syncType() {
        return syncType;
    }

    public int clientVersion() {
        return clientVersion;
    }

    /**
     * Source of compressed sprite pixels, or null to leave the sprite hash untouched.
     */
    public SpritePixelProvider pixelProvider() {
        return pixelProvider;
    }

    public boolean transparent() {
        return transparent;
    }

    public Builder toBuilder() {
        return new Builder()
                .syncType(syncType)
                .clientVersion(clientVersion)
                .pixelProvider(pixelProvider)
                .transparent(transparent);
    }

    public static final class Builder {
        private boolean syncType;
        private int clientVersion;
        private SpritePixelProvider pixelProvider;
        private boolean transparent;

        private Builder() {
        }

        public Builder syncType(boolean syncType) {
            this.syncType = syncType;
            return this;
        }

        /**
         * Client version as an integer, e.g. {@code 1098}. Versions below 1010 clear forceUse and fullGround.
         */
        public Builder clientVersion(int clientVersion) {
            if (clientVersion < 0) {
                throw new IllegalArgumentException("clientVersion must be non-negative");
            }
            this.clientVersion = clientVersion;
            return this;
        }

        public Builder pixelProvider(SpritePixelProvider pixelProvider) {
            this.pixelProvider = pixelProvider;
            return this;
        }

        public Builder transparent(boolean transparent) {
            this.transparent = transparent;
            return this;
        }

        public SyncOptions build() {
            return new SyncOptions(this);
        }
    }
}
