package com.libragraph.chatmedia.core.error;

/**
 * Unchecked failure of a pipeline operation, tagged with its {@link ErrorKind}.
 */
public class PipelineException extends RuntimeException {

    private final ErrorKind kind;

    public PipelineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PipelineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
