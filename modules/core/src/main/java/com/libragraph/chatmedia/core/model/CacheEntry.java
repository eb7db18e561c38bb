package com.libragraph.chatmedia.core.model;

import com.libragraph.chatmedia.types.AttachmentVariant;
import com.libragraph.chatmedia.types.MediaKind;
import com.libragraph.chatmedia.util.ContentId;

import java.nio.file.Path;

/**
 * Cached mapping from a content identifier to its output file.
 * Entries found by the output scan start unvalidated, with no MIME type or variant,
 * and are never marked degraded.
 */
public record CacheEntry(
        ContentId key,
        MediaKind kind,
        Path path,
        AttachmentVariant variant,
        String mimeType,
        Double durationSeconds,
        boolean validated,
        boolean degraded
) {
    public static CacheEntry discovered(ContentId key, MediaKind kind, Path path) {
        return new CacheEntry(key, kind, path, null, null, null, false, false);
    }

    public static CacheEntry of(ResolvedMedia media) {
        return new CacheEntry(media.key(), media.kind(), media.path(), media.variant(),
                media.mimeType(), media.durationSeconds(), true, media.degraded());
    }

    public CacheEntry validatedAs(String mimeType, Double durationSeconds) {
        return new CacheEntry(key, kind, path, variant, mimeType, durationSeconds, true, degraded);
    }

    public ResolvedMedia toMedia(long sizeBytes) {
        return new ResolvedMedia(key, kind, path, variant, mimeType, sizeBytes, durationSeconds, true, degraded);
    }
}
