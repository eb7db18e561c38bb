package com.libragraph.chatmedia.core.model;

import com.libragraph.chatmedia.core.error.PipelineError;

/**
 * Per-reference outcome in a batch.
 */
public sealed interface Resolution {

    record Resolved(ResolvedMedia media) implements Resolution {}

    record Failed(PipelineError error) implements Resolution {}

    static Resolution resolved(ResolvedMedia media) {
        return new Resolved(media);
    }

    static Resolution failed(PipelineError error) {
        return new Failed(error);
    }

    static Resolution failed(Throwable t) {
        return new Failed(PipelineError.from(t));
    }

    default boolean isResolved() {
        return this instanceof Resolved;
    }
}
