package com.libragraph.chatmedia.api;

import com.libragraph.chatmedia.core.model.ResolvedMedia;

public record MediaView(
        String key,
        String kind,
        String path,
        String variant,
        String mimeType,
        long sizeBytes,
        Double durationSeconds,
        boolean fromCache,
        boolean degraded
) {
    public static MediaView of(ResolvedMedia media) {
        return new MediaView(
                media.key().value(),
                media.kind().label(),
                media.path().toAbsolutePath().toString(),
                media.variant() == null ? null : media.variant().name(),
                media.mimeType(),
                media.sizeBytes(),
                media.durationSeconds(),
                media.fromCache(),
                media.degraded());
    }
}
