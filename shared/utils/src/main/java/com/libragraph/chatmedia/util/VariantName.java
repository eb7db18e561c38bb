package com.libragraph.chatmedia.util;

import com.libragraph.chatmedia.types.AttachmentVariant;

import java.util.Locale;
import java.util.Set;

/**
 * A file name split into its normalized content base and variant tag.
 *
 * <p>Recognized forms (case-insensitive):
 * <ul>
 *   <li>{@code abc.dat}, {@code abc.jpg} → ORIGINAL</li>
 *   <li>{@code abc_b.dat}, {@code abc_h.dat}, {@code abc_c.dat}, {@code abc_t.dat} → tagged variant</li>
 *   <li>{@code abc.t.dat} → THUMBNAIL</li>
 *   <li>{@code abc_x.dat} with any other single letter → OTHER</li>
 * </ul>
 *
 * @param base      lowercase name without extension and tag
 * @param variant   detected variant
 * @param extension lowercase extension including the dot, or empty
 */
public record VariantName(String base, AttachmentVariant variant, String extension) {

    private static final Set<String> KNOWN_EXTENSIONS =
            Set.of(".dat", ".jpg", ".jpeg", ".png", ".gif", ".webp");

    public static VariantName parse(String fileName) {
        String name = fileName.trim().toLowerCase(Locale.ROOT);

        String extension = "";
        int dot = name.lastIndexOf('.');
        if (dot > 0 && KNOWN_EXTENSIONS.contains(name.substring(dot))) {
            extension = name.substring(dot);
            name = name.substring(0, dot);
        }

        if (name.length() > 2 && name.endsWith(".t")) {
            return new VariantName(name.substring(0, name.length() - 2),
                    AttachmentVariant.THUMBNAIL, extension);
        }

        int len = name.length();
        if (len > 2 && name.charAt(len - 2) == '_' && Character.isLetter(name.charAt(len - 1))) {
            return new VariantName(name.substring(0, len - 2),
                    AttachmentVariant.fromTagLetter(name.charAt(len - 1)), extension);
        }

        return new VariantName(name, AttachmentVariant.ORIGINAL, extension);
    }

    public boolean isDat() {
        return extension.equals(".dat");
    }
}
