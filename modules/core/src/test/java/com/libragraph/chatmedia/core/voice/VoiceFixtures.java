package com.libragraph.chatmedia.core.voice;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

final class VoiceFixtures {

    static final int SAMPLE_RATE = 24_000;

    private VoiceFixtures() {
    }

    /** Mono 16-bit little-endian sine tone. */
    static byte[] sinePcm(double seconds) {
        int samples = (int) (SAMPLE_RATE * seconds);
        ByteBuffer buffer = ByteBuffer.allocate(samples * 2).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < samples; i++) {
            buffer.putShort((short) (Math.sin(2 * Math.PI * 440 * i / SAMPLE_RATE) * 12_000));
        }
        return buffer.array();
    }

    /**
     * Writes an executable shell script standing in for the speech decoder.
     * Arguments are {@code input output -Fs_API rate}.
     */
    static Path script(Path dir, String name, String body) {
        try {
            Files.createDirectories(dir);
            Path script = Files.writeString(dir.resolve(name), "#!/bin/sh\n" + body + "\n");
            if (!script.toFile().setExecutable(true)) {
                throw new IllegalStateException("Cannot make " + script + " executable");
            }
            return script;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Decoder that treats its input as raw PCM already. */
    static Path copyingDecoder(Path dir) {
        return script(dir, "copy-decoder", "cp \"$1\" \"$2\"");
    }
}
