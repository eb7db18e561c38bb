package com.libragraph.chatmedia.core.variant;

import com.libragraph.chatmedia.types.AttachmentVariant;

import java.nio.file.Path;

public record VariantCandidate(AttachmentVariant variant, Path path) {
}
