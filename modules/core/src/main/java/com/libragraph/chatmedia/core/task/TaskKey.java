package com.libragraph.chatmedia.core.task;

import com.libragraph.chatmedia.types.MediaKind;
import com.libragraph.chatmedia.util.ContentId;

/**
 * Deduplication key: one running task per content identifier and media kind.
 */
public record TaskKey(MediaKind kind, ContentId id) {

    @Override
    public String toString() {
        return kind.label() + ":" + id;
    }
}
