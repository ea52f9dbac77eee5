package com.vcdcli.exception;

/**
 * Classifies why a network command failed. Each kind maps to the process exit status
 * reported when the command runs non-interactively.
 */
public enum ErrorKind {

    /** The server declined the request: not found, duplicate, conflict or malformed value. */
    REMOTE_REJECTED(1),

    /** A required argument was missing or flags contradicted each other. Nothing was sent. */
    VALIDATION(2),

    /** A VDC-scoped command ran without a selected virtual datacenter. */
    NO_VDC_SELECTED(3),

    /** No usable session, or the server refused the session token. */
    AUTH_FAILURE(4),

    /** The server could not be reached. */
    CONNECTION_FAILURE(5),

    INTERNAL(70);

    private final int exitCode;

    ErrorKind(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
