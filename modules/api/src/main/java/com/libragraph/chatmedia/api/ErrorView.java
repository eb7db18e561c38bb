package com.libragraph.chatmedia.api;

import com.libragraph.chatmedia.core.error.PipelineError;

/**
 * @param kind       error kind label, e.g. {@code SourceMissing}
 * @param affordance what a client can do about it
 */
public record ErrorView(String kind, String affordance, String message) {

    public static ErrorView of(PipelineError error) {
        return new ErrorView(error.kind().label(), error.affordance().name(), error.message());
    }
}
