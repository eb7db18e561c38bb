package com.libragraph.chatmedia.types;

import java.util.Comparator;

/**
 * Physical rendition of one logical attachment. Lower rank is preferred.
 *
 * <p>The tag is the file-name marker the chat client appends to the content
 * name ({@code abc_b.dat}, {@code abc_t.dat}); {@link #ORIGINAL} carries none.
 */
public enum AttachmentVariant {
    BIG(0, "_b"),
    ORIGINAL(1, ""),
    HIGH(2, "_h"),
    CACHE(3, "_c"),
    THUMBNAIL(4, "_t"),
    OTHER(5, null);

    public static final Comparator<AttachmentVariant> BY_PREFERENCE =
            Comparator.comparingInt(AttachmentVariant::rank);

    private final int rank;
    private final String tag;

    AttachmentVariant(int rank, String tag) {
        this.rank = rank;
        this.tag = tag;
    }

    public int rank() {
        return rank;
    }

    /** File-name tag, empty for ORIGINAL, null for OTHER. */
    public String tag() {
        return tag;
    }

    public boolean isPreferredOver(AttachmentVariant other) {
        return rank < other.rank;
    }

    /** Maps a tag letter ({@code 'b'}, {@code 'h'}, ...) to its variant; unknown letters map to OTHER. */
    public static AttachmentVariant fromTagLetter(char letter) {
        char lower = Character.toLowerCase(letter);
        for (AttachmentVariant v : values()) {
            if (v.tag != null && v.tag.length() == 2 && v.tag.charAt(1) == lower) {
                return v;
            }
        }
        return OTHER;
    }
}
