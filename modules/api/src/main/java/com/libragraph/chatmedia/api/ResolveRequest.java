package com.libragraph.chatmedia.api;

import com.libragraph.chatmedia.core.model.AttachmentReference;
import com.libragraph.chatmedia.types.MediaKind;

import java.util.Locale;

/**
 * Wire form of an {@link AttachmentReference}. {@code kind} is the kind label
 * ({@code image}, {@code sticker} or {@code voice}).
 */
public record ResolveRequest(
        String kind,
        String contentHash,
        String fallbackName,
        String senderId,
        long timestamp,
        long localMessageId
) {
    public AttachmentReference toReference() {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind is required");
        }
        String label = kind.trim().toLowerCase(Locale.ROOT);
        for (MediaKind k : MediaKind.values()) {
            if (k.label().equals(label)) {
                return new AttachmentReference(contentHash, fallbackName, k, senderId, timestamp, localMessageId);
            }
        }
        throw new IllegalArgumentException("Unknown media kind: " + kind);
    }

    public static ResolveRequest of(AttachmentReference ref) {
        return new ResolveRequest(ref.kind().label(), ref.contentHash(), ref.fallbackName(),
                ref.senderId(), ref.timestamp(), ref.localMessageId());
    }
}
