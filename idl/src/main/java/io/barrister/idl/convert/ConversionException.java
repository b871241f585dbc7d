package io.barrister.idl.convert;

/**
 * Thrown when a value does not conform to its IDL type, or cannot be represented by the
 * requested Java type.
 * <p>
 * The exception carries the path of the offending value, for example
 * {@code param[0].items[2]}, so that a failure can be diagnosed without the IDL source.
 * The message is suitable for a JSON-RPC {@code invalid params} error as is.
 */
public class ConversionException extends Exception {

    private final String path;
    private final String reason;

    public ConversionException(final String path, final String reason) {
        super(format(path, reason));
        this.path = path;
        this.reason = reason;
    }

    public ConversionException(final String path, final String reason, final Throwable cause) {
        super(format(path, reason), cause);
        this.path = path;
        this.reason = reason;
    }

    private static String format(String path, String reason) {
        if (path.isEmpty()) {
            return reason;
        }
        return "Invalid value for '" + path + "': " + reason;
    }

    /**
     * Returns the path of the value that failed to convert.
     *
     * @return the dotted and bracketed path, empty for a top-level value without a name
     */
    public String getPath() {
        return path;
    }

    /**
     * Returns the failure description without the path.
     *
     * @return the reason
     */
    public String getReason() {
        return reason;
    }
}
