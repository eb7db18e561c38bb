package com.libragraph.chatmedia.core.voice;

import com.libragraph.chatmedia.core.error.ErrorKind;
import com.libragraph.chatmedia.core.error.PipelineException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class DecoderLocatorTest {

    @TempDir
    Path dir;

    @Test
    void shouldUseExplicitPath() {
        Path script = VoiceFixtures.script(dir, "my-decoder", "exit 0");

        assertThat(new DecoderLocator(Optional.of(script), List.of(), dir.resolve("extract")).locate())
                .isEqualTo(script);
    }

    @Test
    void shouldRejectNonExecutableExplicitPath() throws Exception {
        Path plain = Files.writeString(dir.resolve("not-executable"), "data");

        assertThatThrownBy(() -> new DecoderLocator(Optional.of(plain), List.of(), dir).locate())
                .isInstanceOfSatisfying(PipelineException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.DECODE_FAILED));
    }

    @Test
    void shouldSearchConfiguredDirectories() {
        Path script = VoiceFixtures.script(dir.resolve("tools"), DecoderLocator.BINARY_NAME, "exit 0");

        assertThat(new DecoderLocator(Optional.empty(), List.of(dir.resolve("empty"), dir.resolve("tools")),
                dir.resolve("extract")).locate()).isEqualTo(script);
    }

    @Test
    void shouldExtractBundledBinary() throws Exception {
        Path resources = dir.resolve("classpath");
        VoiceFixtures.script(resources.resolve("chatmedia/bin/" + DecoderLocator.platform()),
                DecoderLocator.BINARY_NAME, "exit 0");
        Path extractDir = dir.resolve("extract");

        try (URLClassLoader loader = new URLClassLoader(new URL[]{resources.toUri().toURL()}, null)) {
            Path located = new DecoderLocator(Optional.empty(), List.of(), extractDir, loader).locate();

            assertThat(located).isEqualTo(extractDir.resolve(DecoderLocator.BINARY_NAME));
            assertThat(Files.isExecutable(located)).isTrue();
        }
    }

    @Test
    void shouldFailWhenNothingIsAvailable() throws Exception {
        try (URLClassLoader loader = new URLClassLoader(new URL[0], null)) {
            DecoderLocator locator = new DecoderLocator(Optional.empty(), List.of(), dir.resolve("extract"), loader);

            assertThatThrownBy(locator::locate)
                    .isInstanceOfSatisfying(PipelineException.class,
                            e -> assertThat(e.kind()).isEqualTo(ErrorKind.DECODE_FAILED));
        }
    }
}
