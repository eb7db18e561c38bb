package com.libragraph.chatmedia.types;

import java.util.Locale;

/**
 * Kind of chat attachment. Each kind owns one directory of the output tree.
 */
public enum MediaKind {
    IMAGE(0, "image", "images"),
    VOICE(1, "voice", "voices"),
    STICKER(2, "sticker", "emojis");

    private final int id;
    private final String label;
    private final String directory;

    MediaKind(int id, String label, String directory) {
        this.id = id;
        this.label = label;
        this.directory = directory;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    /** Name of the output sub-directory holding this kind, e.g. {@code images}. */
    public String directory() {
        return directory;
    }

    public boolean isImage() {
        return this != VOICE;
    }

    public static MediaKind fromId(int id) {
        for (MediaKind k : values()) {
            if (k.id == id) return k;
        }
        throw new IllegalArgumentException("Unknown MediaKind id: " + id);
    }

    /**
     * Accepts the label ({@code "voice"}), the enum name ({@code "VOICE"}) or the
     * legacy {@code "emoji"} alias for stickers.
     */
    public static MediaKind fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("MediaKind label cannot be null");
        }
        String lower = label.trim().toLowerCase(Locale.ROOT);
        if (lower.equals("emoji")) {
            return STICKER;
        }
        for (MediaKind k : values()) {
            if (k.label.equals(lower)) return k;
        }
        throw new IllegalArgumentException("Unknown MediaKind label: " + label);
    }

    public static MediaKind fromDirectory(String directory) {
        for (MediaKind k : values()) {
            if (k.directory.equals(directory)) return k;
        }
        throw new IllegalArgumentException("Unknown media directory: " + directory);
    }
}
