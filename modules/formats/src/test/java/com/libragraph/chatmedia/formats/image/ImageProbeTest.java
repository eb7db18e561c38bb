package com.libragraph.chatmedia.formats.image;

import com.libragraph.chatmedia.formats.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class ImageProbeTest {

    @TempDir
    Path dir;

    @Test
    void shouldAcceptDecodableImages() throws Exception {
        Path png = Files.write(dir.resolve("a.png"), TestImages.png());
        Path jpg = Files.write(dir.resolve("a.jpg"), TestImages.jpeg());

        assertThat(ImageProbe.probe(png)).contains(ImageSignature.PNG);
        assertThat(ImageProbe.probe(jpg)).contains(ImageSignature.JPEG);
    }

    @Test
    void shouldRejectTruncatedImage() throws Exception {
        byte[] png = TestImages.png();
        Path truncated = Files.write(dir.resolve("cut.png"), Arrays.copyOf(png, 40));

        assertThat(ImageProbe.probe(truncated)).isEmpty();
    }

    @Test
    void shouldRejectUnknownBytes() throws Exception {
        Path junk = Files.write(dir.resolve("junk.png"), "not an image at all".getBytes());

        assertThat(ImageProbe.probe(junk)).isEmpty();
    }

    @Test
    void shouldRejectMissingFile() {
        assertThat(ImageProbe.probe(dir.resolve("missing.png"))).isEmpty();
    }
}
