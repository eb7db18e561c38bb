package com.libragraph.chatmedia.formats.detect;

import com.libragraph.chatmedia.formats.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class MediaTypeDetectorTest {

    @TempDir
    Path dir;

    @Test
    void shouldDetectByContentNotName() throws Exception {
        Path misnamed = Files.write(dir.resolve("picture.bin"), TestImages.png());

        assertThat(MediaTypeDetector.detect(misnamed)).isEqualTo("image/png");
    }

    @Test
    void shouldDetectJpeg() throws Exception {
        Path jpeg = Files.write(dir.resolve("photo.jpg"), TestImages.jpeg());

        assertThat(MediaTypeDetector.detect(jpeg)).isEqualTo("image/jpeg");
    }

    @Test
    void shouldFallBackToOctetStreamForMissingFile() {
        assertThat(MediaTypeDetector.detect(dir.resolve("missing"))).isEqualTo("application/octet-stream");
    }
}
