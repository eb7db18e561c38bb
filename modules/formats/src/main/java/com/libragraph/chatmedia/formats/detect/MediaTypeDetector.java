package com.libragraph.chatmedia.formats.detect;

import org.apache.tika.detect.DefaultDetector;
import org.apache.tika.detect.Detector;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.mime.MediaType;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Content-based MIME detection using Apache Tika.
 */
public final class MediaTypeDetector {

    private static final Logger LOG = Logger.getLogger(MediaTypeDetector.class);
    private static final Detector DETECTOR = new DefaultDetector();

    private MediaTypeDetector() {
    }

    /**
     * Detects the MIME type of a file, using its name only as a tie-breaker.
     * Returns {@code application/octet-stream} if detection fails.
     */
    public static String detect(Path file) {
        Metadata metadata = new Metadata();
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, file.getFileName().toString());
        try (TikaInputStream stream = TikaInputStream.get(file)) {
            return DETECTOR.detect(stream, metadata).getBaseType().toString();
        } catch (IOException e) {
            LOG.debugf("MIME detection failed for %s: %s", file, e.getMessage());
            return MediaType.OCTET_STREAM.toString();
        }
    }
}
