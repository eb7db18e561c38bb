package com.libragraph.chatmedia.core.model;

import com.libragraph.chatmedia.types.MediaKind;
import com.libragraph.chatmedia.util.ContentId;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A chat message's pointer to one attachment, as handed over by the message layer.
 *
 * @param contentHash    content hash of the attachment, if the message carries one
 * @param fallbackName   dat file name, if known
 * @param kind           media kind
 * @param senderId       account id of the sender (voice blobs are keyed by it)
 * @param timestamp      message create time in seconds
 * @param localMessageId local message id
 */
public record AttachmentReference(
        String contentHash,
        String fallbackName,
        MediaKind kind,
        String senderId,
        long timestamp,
        long localMessageId
) {
    public AttachmentReference {
        Objects.requireNonNull(kind, "kind cannot be null");
    }

    public static AttachmentReference image(String contentHash, String fallbackName, long localMessageId) {
        return new AttachmentReference(contentHash, fallbackName, MediaKind.IMAGE, null, 0, localMessageId);
    }

    public static AttachmentReference sticker(String contentHash, String fallbackName) {
        return new AttachmentReference(contentHash, fallbackName, MediaKind.STICKER, null, 0, 0);
    }

    public static AttachmentReference voice(String senderId, long timestamp, long localMessageId) {
        return new AttachmentReference(null, null, MediaKind.VOICE, senderId, timestamp, localMessageId);
    }

    /**
     * Stable identifier for this attachment.
     * Images and stickers use the hash, then the dat name, then {@code img_{localId}}.
     */
    public ContentId contentId() {
        if (kind == MediaKind.VOICE) {
            return ContentId.forVoice(senderId, timestamp, localMessageId);
        }
        if (!isBlank(contentHash)) {
            return ContentId.ofName(contentHash);
        }
        if (!isBlank(fallbackName)) {
            return ContentId.ofName(fallbackName);
        }
        return ContentId.forLocalImage(localMessageId);
    }

    /**
     * Names to probe under the account root, dat name first.
     */
    public List<String> probeNames() {
        List<String> names = new ArrayList<>(2);
        if (!isBlank(fallbackName)) {
            names.add(fallbackName.trim());
        }
        if (!isBlank(contentHash) && !names.contains(contentHash.trim())) {
            names.add(contentHash.trim());
        }
        return names;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
