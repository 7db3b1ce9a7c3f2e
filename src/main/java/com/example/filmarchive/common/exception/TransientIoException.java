package com.example.filmarchive.common.exception;

/**
 * A filesystem condition expected to clear on its own: a file that vanished between
 * polls, a directory that cannot be created yet. Logged and retried, never counted.
 */
public class TransientIoException extends PipelineException {

    public TransientIoException(String message) {
        super("TRANSIENT_IO", message);
    }

    public TransientIoException(String message, Throwable cause) {
        super("TRANSIENT_IO", message, cause);
    }
}
