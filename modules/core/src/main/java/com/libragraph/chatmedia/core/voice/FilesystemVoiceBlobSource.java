package com.libragraph.chatmedia.core.voice;

import com.libragraph.chatmedia.util.FileNames;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads voice blobs from disk.
 *
 * <p>Layout: {@code {root}/{sanitized sender}/{timestamp}.silk}
 */
public class FilesystemVoiceBlobSource implements VoiceBlobSource {

    public static final String EXTENSION = ".silk";

    private final Path root;

    public FilesystemVoiceBlobSource(Path root) {
        this.root = root;
    }

    public Path pathFor(String senderId, long timestamp) {
        String sender = senderId == null || senderId.isBlank() ? "unknown" : FileNames.sanitizeSegment(senderId);
        return root.resolve(sender).resolve(timestamp + EXTENSION);
    }

    @Override
    public Optional<byte[]> fetch(String senderId, long timestamp) throws IOException {
        if (root == null) {
            return Optional.empty();
        }
        Path path = pathFor(senderId, timestamp);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        byte[] bytes = Files.readAllBytes(path);
        return bytes.length == 0 ? Optional.empty() : Optional.of(bytes);
    }
}
