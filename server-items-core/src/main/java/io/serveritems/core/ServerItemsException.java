package io.serveritems.core;

/**
 * Base class for fatal server item database errors.
 *
 * <p>Thrown for structural problems that abort an operation. Advisory conditions, such as unknown
 * items.xml attributes, are reported through result objects instead.
 */
public abstract class ServerItemsException extends RuntimeException {

    protected ServerItemsException(String message) {
        super(message);
    }

    protected ServerItemsException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when an OTB node stream is truncated, lacks a root node or has a property shorter than declared.
     */
    public static class MalformedNodeStream extends ServerItemsException {
        public MalformedNodeStream(String message) {
            super(message);
        }
    }

    /**
     * Raised when the OTB root VERSION attribute does not have the expected size.
     */
    public static class InvalidVersionHeader extends ServerItemsException {
        private final int length;

        public InvalidVersionHeader(int length) {
            super("OTB: invalid version header size: " + length);
            this.length = length;
        }

        public int length() {
            return length;
        }
    }

    /**
     * Raised when a thing-type property flag byte is not part of the known vocabulary.
     */
    public static class UnknownPropertyFlag extends ServerItemsException {
        private final int code;

        public UnknownPropertyFlag(int code) {
            super(String.format("Unknown property flag 0x%02X", code));
            this.code = code;
        }

        public int code() {
            return code;
        }
    }

    /**
     * Raised when an operation needs a loaded server item database and none is loaded.
     */
    public static class NotLoaded extends ServerItemsException {
        public NotLoaded(String message) {
            super(message);
        }
    }

    /**
     * Raised when a bundled attribute schema resource is missing or cannot be parsed.
     */
    public static class SchemaUnavailable extends ServerItemsException {
        public SchemaUnavailable(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
