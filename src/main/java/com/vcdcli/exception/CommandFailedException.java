package com.vcdcli.exception;

/**
 * Thrown by the command table when an operation finished with a failed outcome, so that the
 * shell's exception resolver can print the message and set the exit status.
 */
public class CommandFailedException extends RuntimeException {

    private final ErrorKind kind;

    public CommandFailedException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
