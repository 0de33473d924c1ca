package io.serveritems.service;

import java.util.Objects;

/**
 * Input of {@link ServerItemsService#load(LoadRequest)}: the raw OTB file, optionally the items.xml text and
 * the attribute server it was written for.
 */
public final class LoadRequest {
    private final byte[] otbBuffer;
    private final String xmlContent;
    private final String attributeServer;

    private LoadRequest(Builder builder) {
        this.otbBuffer = builder.otbBuffer;
        this.xmlContent = builder.xmlContent;
        this.attributeServer = builder.attributeServer;
    }

    public static LoadRequest of(byte[] otbBuffer) {
        return builder(otbBuffer).build();
    }

    public static Builder builder(byte[] otbBuffer) {
        return new Builder(otbBuffer);
    }

    public byte[] otbBuffer() {
        return otbBuffer;
    }

    /**
     * items.xml content, or null when only the OTB file is loaded.
     */
    public String xmlContent() {
        return xmlContent;
    }

    public String attributeServer() {
        return attributeServer;
    }

    public static final class Builder {
        private final byte[] otbBuffer;
        private String xmlContent;
        private String attributeServer;

        private Builder(byte[] otbBuffer) {
            this.otbBuffer = Objects.requireNonNull(otbBuffer, "otbBuffer");
        }

        public Builder xmlContent(String xmlContent) {
            this.xmlContent = xmlContent;
            return this;
        }

        public Builder attributeServer(String attributeServer) {
            this.attributeServer = attributeServer;
            return this;
        }

        public LoadRequest build() {
            return new LoadRequest(this);
        }
    }
}
