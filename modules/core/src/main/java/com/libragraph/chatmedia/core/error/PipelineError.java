package com.libragraph.chatmedia.core.error;

import com.libragraph.chatmedia.formats.crypto.DatDecryptionException;
import com.libragraph.chatmedia.formats.crypto.MissingKeyException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Serializable description of a failed resolution, as carried in batch results.
 */
public record PipelineError(
        ErrorKind kind,
        String message,
        String exceptionType
) {
    public static PipelineError from(Throwable t) {
        Throwable cause = unwrap(t);
        return new PipelineError(kindOf(cause), cause.getMessage(), cause.getClass().getName());
    }

    public ErrorKind.Affordance affordance() {
        return kind.affordance();
    }

    /**
     * Maps any throwable to the kind callers see.
     */
    public static ErrorKind kindOf(Throwable t) {
        Throwable cause = unwrap(t);
        if (cause instanceof PipelineException pe) {
            return pe.kind();
        }
        if (cause instanceof MissingKeyException) {
            return ErrorKind.KEY_MISSING;
        }
        if (cause instanceof DatDecryptionException) {
            return ErrorKind.DECRYPTION_FAILED;
        }
        if (cause instanceof TimeoutException || cause instanceof CancellationException) {
            return ErrorKind.TIMEOUT;
        }
        return ErrorKind.UNRESOLVABLE;
    }

    /** Strips future wrappers. */
    public static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
