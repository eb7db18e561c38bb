package com.libragraph.chatmedia.util;

import java.util.Locale;
import java.util.Objects;

/**
 * Stable key naming one logical attachment, independent of its on-disk variant.
 * Immutable value object used as cache and dedup key.
 *
 * <p>Values are lowercase. Image and sticker ids are normalized with
 * {@link VariantName#parse(String)} so that {@code ABC_b.dat} and {@code abc}
 * name the same attachment; voice ids are a composite of timestamp, local
 * message id and sender.
 */
public record ContentId(String value) {

    public ContentId {
        Objects.requireNonNull(value, "content id cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("content id cannot be blank");
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * Creates an id from a hash or dat name, stripping extensions and variant tags.
     */
    public static ContentId ofName(String raw) {
        Objects.requireNonNull(raw, "name cannot be null");
        return new ContentId(VariantName.parse(raw).base());
    }

    /**
     * Composite id for voice notes: {@code {timestamp}_{localId}_{sender}}.
     */
    public static ContentId forVoice(String senderId, long timestamp, long localMessageId) {
        String sender = senderId == null || senderId.isBlank()
                ? "unknown"
                : FileNames.sanitizeSegment(senderId);
        return new ContentId(timestamp + "_" + localMessageId + "_" + sender);
    }

    /** Fallback id for images without hash or dat name. */
    public static ContentId forLocalImage(long localMessageId) {
        return new ContentId("img_" + localMessageId);
    }

    /** File-system safe form of this id. */
    public String fileName() {
        return FileNames.sanitize(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
