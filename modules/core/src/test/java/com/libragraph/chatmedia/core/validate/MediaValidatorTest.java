package com.libragraph.chatmedia.core.validate;

import com.libragraph.chatmedia.core.CoreFixtures;
import com.libragraph.chatmedia.types.MediaKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static com.libragraph.chatmedia.core.CoreFixtures.write;
import static org.assertj.core.api.Assertions.*;

class MediaValidatorTest {

    @TempDir
    Path dir;

    private final MediaValidator validator = new MediaValidator();

    @Test
    void shouldAcceptDecodableImage() {
        Path file = write(dir, "ok.png", CoreFixtures.png());

        MediaValidator.Validation result = validator.validate(file, MediaKind.IMAGE);

        assertThat(result.usable()).isTrue();
        assertThat(result.mimeType()).isEqualTo("image/png");
        assertThat(result.durationSeconds()).isNull();
    }

    @Test
    void shouldRejectTruncatedImageAndRememberIt() {
        Path file = write(dir, "bad.png", CoreFixtures.truncatedPng());

        assertThat(validator.validate(file, MediaKind.IMAGE).usable()).isFalse();
        assertThat(validator.isRejected(file)).isTrue();
        assertThat(validator.validate(file, MediaKind.IMAGE).reason()).isEqualTo("previously rejected");
        assertThat(validator.rejectedCount()).isEqualTo(1);
    }

    @Test
    void shouldRejectEmptyFile() {
        Path file = write(dir, "empty.png", new byte[0]);

        assertThat(validator.validate(file, MediaKind.IMAGE).reason()).isEqualTo("empty file");
    }

    @Test
    void shouldRejectNonAudioAsVoice() {
        Path file = write(dir, "fake.mp3", CoreFixtures.png());

        assertThat(validator.validate(file, MediaKind.VOICE).usable()).isFalse();
    }

    @Test
    void shouldRejectMissingFile() {
        assertThat(validator.validate(dir.resolve("nope.png"), MediaKind.IMAGE).usable()).isFalse();
    }
}
