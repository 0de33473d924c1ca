package io.serveritems.service;

import java.nio.charset.Charset;
import java.util.Objects;

/**
 * Serialized session: the OTB bytes and the items.xml text with the encoding its declaration names.
 */
public record SaveResult(byte[] otbBuffer, String xmlContent, String xmlEncoding) {

    public SaveResult {
        Objects.requireNonNull(otbBuffer, "otbBuffer");
        Objects.requireNonNull(xmlContent, "xmlContent");
        Objects.requireNonNull(xmlEncoding, "xmlEncoding");
        otbBuffer = otbBuffer.clone();
    }

    @Override
    public byte[] otbBuffer() {
        return otbBuffer.clone();
    }

    /**
     * items.xml encoded with {@link #xmlEncoding()}, ready to be written to disk.
     */
    public byte[] xmlBytes() {
        return xmlContent.getBytes(Charset.forName(xmlEncoding));
    }
}
