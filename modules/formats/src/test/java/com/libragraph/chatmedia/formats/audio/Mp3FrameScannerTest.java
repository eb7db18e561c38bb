package com.libragraph.chatmedia.formats.audio;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;

import static org.assertj.core.api.Assertions.*;

class Mp3FrameScannerTest {

    /** MPEG-2 Layer III, 32 kbps, 24 kHz, no padding: 72 * 32000 / 24000 = 96 bytes. */
    private static byte[] frame() {
        byte[] frame = new byte[96];
        frame[0] = (byte) 0xFF;
        frame[1] = (byte) 0xF3;
        frame[2] = (byte) 0x44;
        frame[3] = (byte) 0xC4;
        return frame;
    }

    private static byte[] frames(int count) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int i = 0; i < count; i++) {
            out.writeBytes(frame());
        }
        return out.toByteArray();
    }

    @Test
    void shouldCountFramesAndDuration() {
        Mp3Info info = Mp3FrameScanner.scan(frames(125)).orElseThrow();

        assertThat(info.frames()).isEqualTo(125);
        assertThat(info.sampleRate()).isEqualTo(24000);
        assertThat(info.durationSeconds()).isCloseTo(3.0, within(0.001));
    }

    @Test
    void shouldSkipId3v2Tag() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(new byte[]{'I', 'D', '3', 4, 0, 0, 0, 0, 0, 20});
        out.writeBytes(new byte[20]);
        out.writeBytes(frames(10));

        assertThat(Mp3FrameScanner.scan(out.toByteArray())).hasValueSatisfying(info ->
                assertThat(info.frames()).isEqualTo(10));
    }

    @Test
    void shouldTolerateId3v1Trailer() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(frames(3));
        byte[] tag = new byte[128];
        tag[0] = 'T';
        tag[1] = 'A';
        tag[2] = 'G';
        out.writeBytes(tag);

        assertThat(Mp3FrameScanner.scan(out.toByteArray())).hasValueSatisfying(info ->
                assertThat(info.frames()).isEqualTo(3));
    }

    @Test
    void shouldRejectNonMp3Data() {
        assertThat(Mp3FrameScanner.scan("definitely not audio".getBytes())).isEmpty();
        assertThat(Mp3FrameScanner.scan(new byte[0])).isEmpty();
    }

    @Test
    void shouldRejectSingleFrameFollowedByGarbage() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(frame());
        out.writeBytes("garbage garbage garbage".getBytes());

        assertThat(Mp3FrameScanner.scan(out.toByteArray())).isEmpty();
    }
}
