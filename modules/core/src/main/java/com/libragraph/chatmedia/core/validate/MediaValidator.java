package com.libragraph.chatmedia.core.validate;

import com.libragraph.chatmedia.formats.audio.Mp3FrameScanner;
import com.libragraph.chatmedia.formats.audio.Mp3Info;
import com.libragraph.chatmedia.formats.detect.MediaTypeDetector;
import com.libragraph.chatmedia.formats.image.ImageProbe;
import com.libragraph.chatmedia.formats.image.ImageSignature;
import com.libragraph.chatmedia.types.MediaKind;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Confirms that an output file is a usable image or playable MP3.
 *
 * <p>Files that fail are remembered for the session by path, size and modification
 * time, and rejected again without being read.
 */
public class MediaValidator {

    private static final Logger LOG = Logger.getLogger(MediaValidator.class);

    private static final String MP3_MIME = "audio/mpeg";

    /**
     * @param usable          true if the file can be handed to consumers
     * @param mimeType        detected MIME type, null if unusable
     * @param durationSeconds audio duration, null for images
     * @param reason          why the file is unusable, null if usable
     */
    public record Validation(boolean usable, String mimeType, Double durationSeconds, String reason) {

        static Validation ok(String mimeType, Double durationSeconds) {
            return new Validation(true, mimeType, durationSeconds, null);
        }

        static Validation rejected(String reason) {
            return new Validation(false, null, null, reason);
        }
    }

    private record FileStamp(Path path, long size, FileTime modified) {}

    private final Set<FileStamp> rejected = ConcurrentHashMap.newKeySet();

    public Validation validate(Path path, MediaKind kind) {
        FileStamp stamp;
        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
            stamp = new FileStamp(path.toAbsolutePath(), attrs.size(), attrs.lastModifiedTime());
        } catch (IOException e) {
            return Validation.rejected("unreadable: " + e.getMessage());
        }
        if (rejected.contains(stamp)) {
            return Validation.rejected("previously rejected");
        }
        if (stamp.size() == 0) {
            return reject(stamp, "empty file");
        }

        Validation result = kind == MediaKind.VOICE ? validateAudio(path) : validateImage(path);
        if (!result.usable()) {
            rejected.add(stamp);
            LOG.debugf("Rejected %s: %s", path, result.reason());
        }
        return result;
    }

    /** True if this exact file was rejected before. */
    public boolean isRejected(Path path) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
            return rejected.contains(new FileStamp(path.toAbsolutePath(), attrs.size(), attrs.lastModifiedTime()));
        } catch (IOException e) {
            return false;
        }
    }

    public int rejectedCount() {
        return rejected.size();
    }

    private Validation reject(FileStamp stamp, String reason) {
        rejected.add(stamp);
        return Validation.rejected(reason);
    }

    private Validation validateImage(Path path) {
        Optional<ImageSignature> signature = ImageProbe.probe(path);
        if (signature.isEmpty()) {
            return Validation.rejected("not a decodable image");
        }
        String mime = MediaTypeDetector.detect(path);
        if (!mime.startsWith("image/")) {
            mime = signature.get().mimeType();
        }
        return Validation.ok(mime, null);
    }

    private Validation validateAudio(Path path) {
        Optional<Mp3Info> info;
        try {
            info = Mp3FrameScanner.scan(path);
        } catch (IOException e) {
            return Validation.rejected("unreadable: " + e.getMessage());
        }
        if (info.isEmpty()) {
            return Validation.rejected("not a parseable MP3 stream");
        }
        String mime = MediaTypeDetector.detect(path);
        if (!mime.startsWith("audio/")) {
            mime = MP3_MIME;
        }
        return Validation.ok(mime, info.get().durationSeconds());
    }
}
