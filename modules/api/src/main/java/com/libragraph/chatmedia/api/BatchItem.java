package com.libragraph.chatmedia.api;

import com.libragraph.chatmedia.core.model.AttachmentReference;
import com.libragraph.chatmedia.core.model.Resolution;

public record BatchItem(ResolveRequest reference, String status, MediaView media, ErrorView error) {

    public static BatchItem of(AttachmentReference ref, Resolution resolution) {
        if (resolution instanceof Resolution.Resolved resolved) {
            return new BatchItem(ResolveRequest.of(ref), "resolved", MediaView.of(resolved.media()), null);
        }
        Resolution.Failed failed = (Resolution.Failed) resolution;
        return new BatchItem(ResolveRequest.of(ref), "failed", null, ErrorView.of(failed.error()));
    }
}
