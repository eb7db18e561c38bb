package com.libragraph.chatmedia.core.model;

import com.libragraph.chatmedia.types.AttachmentVariant;
import com.libragraph.chatmedia.types.MediaKind;
import com.libragraph.chatmedia.util.ContentId;

import java.nio.file.Path;

/**
 * A locally usable media file.
 *
 * @param key             content identifier
 * @param kind            media kind
 * @param path            output file
 * @param variant         source variant used, or null for voice notes and files found by the cache scan
 * @param mimeType        content-detected MIME type
 * @param sizeBytes       file size
 * @param durationSeconds audio duration, null for images
 * @param fromCache       true if no work was done for this request
 * @param degraded        true if a better variant existed but was unusable
 */
public record ResolvedMedia(
        ContentId key,
        MediaKind kind,
        Path path,
        AttachmentVariant variant,
        String mimeType,
        long sizeBytes,
        Double durationSeconds,
        boolean fromCache,
        boolean degraded
) {
}
