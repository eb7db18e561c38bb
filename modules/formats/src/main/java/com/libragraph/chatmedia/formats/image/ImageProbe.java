package com.libragraph.chatmedia.formats.image;

import org.jboss.logging.Logger;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Optional;

/**
 * Checks that a file is a decodable image.
 *
 * <p>The header must carry a known signature. When {@code ImageIO} has a reader for
 * the format the first frame is fully decoded and discarded; formats without a
 * reader (WebP on a stock JDK) are accepted on signature alone.
 */
public final class ImageProbe {

    private static final Logger LOG = Logger.getLogger(ImageProbe.class);

    private ImageProbe() {
    }

    /**
     * Returns the detected signature if the file decodes, empty otherwise.
     */
    public static Optional<ImageSignature> probe(Path file) {
        Optional<ImageSignature> signature;
        try (InputStream in = Files.newInputStream(file)) {
            signature = ImageSignature.detect(in.readNBytes(ImageSignature.HEADER_SIZE));
        } catch (IOException e) {
            LOG.debugf("Cannot read image header of %s: %s", file, e.getMessage());
            return Optional.empty();
        }
        if (signature.isEmpty()) {
            return Optional.empty();
        }

        Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName(signature.get().formatName());
        if (!readers.hasNext()) {
            return signature;
        }

        ImageReader reader = readers.next();
        try (ImageInputStream stream = ImageIO.createImageInputStream(file.toFile())) {
            if (stream == null) {
                return Optional.empty();
            }
            reader.setInput(stream, true, true);
            reader.read(0);
            return signature;
        } catch (IOException | RuntimeException e) {
            LOG.debugf("Image %s failed to decode as %s: %s", file, signature.get(), e.getMessage());
            return Optional.empty();
        } finally {
            reader.dispose();
        }
    }
}
