package com.libragraph.chatmedia.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class FileNamesTest {

    @Test
    void shouldReplaceReservedCharacters() {
        assertThat(FileNames.sanitize("a<b>c:d\"e/f\\g|h?i*j")).isEqualTo("a_b_c_d_e_f_g_h_i_j");
    }

    @Test
    void shouldNeverReturnEmpty() {
        assertThat(FileNames.sanitize("   ")).isEqualTo("_");
        assertThat(FileNames.sanitize("..")).isEqualTo("_");
    }

    @Test
    void shouldSanitizeSegments() {
        assertThat(FileNames.sanitizeSegment("wxid abc#1@chat.room")).isEqualTo("wxid_abc_1@chat.room");
    }

    @Test
    void shouldSplitExtensionAndStem() {
        Path path = Path.of("dir", "photo.JPG");

        assertThat(FileNames.extension(path)).isEqualTo(".jpg");
        assertThat(FileNames.stem(path)).isEqualTo("photo");
        assertThat(FileNames.extension(Path.of("noext"))).isEmpty();
    }
}
