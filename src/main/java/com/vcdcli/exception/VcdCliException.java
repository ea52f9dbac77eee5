package com.vcdcli.exception;

/**
 * A runtime exception for failures raised while restoring the session, locating a remote
 * resource or talking to the vCloud API.
 * <p>
 * Every instance carries an {@link ErrorKind} so that the operation invoker can turn it into
 * a failed outcome without inspecting the message.
 */
public class VcdCliException extends RuntimeException {

    private final ErrorKind kind;

    /**
     * Constructs a new VcdCliException with the given kind and detail message.
     *
     * @param kind    The failure classification.
     * @param message The single-line message shown to the user.
     */
    public VcdCliException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Constructs a new VcdCliException with the given kind, detail message and cause.
     *
     * @param kind    The failure classification.
     * @param message The single-line message shown to the user.
     * @param cause   The underlying exception, typically from the HTTP client or JSON parser.
     */
    public VcdCliException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
