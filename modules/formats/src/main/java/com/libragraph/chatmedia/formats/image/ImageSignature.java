package com.libragraph.chatmedia.formats.image;

import java.util.Optional;

/**
 * Image container formats recognized by their leading magic bytes.
 */
public enum ImageSignature {
    GIF(".gif", "image/gif", "gif"),
    PNG(".png", "image/png", "png"),
    JPEG(".jpg", "image/jpeg", "jpeg"),
    WEBP(".webp", "image/webp", "webp");

    private static final byte[] GIF_MAGIC = {'G', 'I', 'F', '8'};
    private static final byte[] PNG_MAGIC = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A};
    private static final byte[] JPEG_MAGIC = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
    private static final byte[] RIFF_MAGIC = {'R', 'I', 'F', 'F'};
    private static final byte[] WEBP_MAGIC = {'W', 'E', 'B', 'P'};

    /** Bytes needed to tell every signature apart. */
    public static final int HEADER_SIZE = 12;

    private final String extension;
    private final String mimeType;
    private final String formatName;

    ImageSignature(String extension, String mimeType, String formatName) {
        this.extension = extension;
        this.mimeType = mimeType;
        this.formatName = formatName;
    }

    /** Output file extension including the dot. */
    public String extension() {
        return extension;
    }

    public String mimeType() {
        return mimeType;
    }

    /** Informal format name as understood by {@code ImageIO}. */
    public String formatName() {
        return formatName;
    }

    /**
     * Detects the signature at the start of {@code header}.
     */
    public static Optional<ImageSignature> detect(byte[] header) {
        if (header == null) {
            return Optional.empty();
        }
        if (startsWith(header, 0, GIF_MAGIC) && header.length >= 6
                && (header[4] == '7' || header[4] == '9') && header[5] == 'a') {
            return Optional.of(GIF);
        }
        if (startsWith(header, 0, PNG_MAGIC)) {
            return Optional.of(PNG);
        }
        if (startsWith(header, 0, JPEG_MAGIC)) {
            return Optional.of(JPEG);
        }
        if (startsWith(header, 0, RIFF_MAGIC) && startsWith(header, 8, WEBP_MAGIC)) {
            return Optional.of(WEBP);
        }
        return Optional.empty();
    }

    public static boolean isImage(byte[] header) {
        return detect(header).isPresent();
    }

    private static boolean startsWith(byte[] header, int offset, byte[] magic) {
        if (header.length < offset + magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (header[offset + i] != magic[i]) {
                return false;
            }
        }
        return true;
    }
}
