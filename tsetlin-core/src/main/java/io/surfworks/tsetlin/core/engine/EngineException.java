package io.surfworks.tsetlin.core.engine;

/**
 * Exception thrown when the native engine cannot be reached or refuses an operation.
 */
public class EngineException extends RuntimeException {

    private final ErrorCode errorCode;

    public EngineException(String message) {
        super(message);
        this.errorCode = ErrorCode.UNKNOWN;
    }

    public EngineException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public EngineException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    /**
     * Engine error codes.
     */
    public enum ErrorCode {
        /** Unknown or unclassified error */
        UNKNOWN,

        /** Library could not be located or opened, or a mandatory symbol is missing */
        LINK_FAILED,

        /** Optional primitive not exported by the loaded library */
        NOT_SUPPORTED,

        /** Engine returned a null machine from create */
        CREATE_FAILED,

        /** Engine returned a null machine from one of its load primitives */
        LOAD_FAILED,

        /** Handle was already released */
        HANDLE_RELEASED
    }

    public static EngineException linkFailed(String what, Throwable cause) {
        return new EngineException("Failed to link native engine: " + what, ErrorCode.LINK_FAILED, cause);
    }

    public static EngineException notSupported(EngineVariant variant, String primitive) {
        return new EngineException(
                String.format("Loaded engine does not export %s", variant.symbol(primitive)),
                ErrorCode.NOT_SUPPORTED);
    }

    public static EngineException createFailed(EngineVariant variant) {
        return new EngineException(
                String.format("Failed to create Tsetlin Machine in native engine (%s returned null)",
                        variant.symbol("create")),
                ErrorCode.CREATE_FAILED);
    }

    public static EngineException loadFailed(String primitive, String path) {
        return new EngineException(
                String.format("%s returned null for %s", primitive, path),
                ErrorCode.LOAD_FAILED);
    }

    public static EngineException handleReleased() {
        return new EngineException("Native machine handle already released", ErrorCode.HANDLE_RELEASED);
    }
}
