package com.libragraph.chatmedia.core.voice;

import java.io.IOException;
import java.util.Optional;

/**
 * Source of raw speech-codec blobs, keyed by sender and message time.
 */
public interface VoiceBlobSource {

    /**
     * Returns the blob bytes, or empty if the source has none for this message.
     */
    Optional<byte[]> fetch(String senderId, long timestamp) throws IOException;
}
