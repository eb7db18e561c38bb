package com.libragraph.chatmedia.formats.audio;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Walks MPEG audio Layer III frame headers to confirm an MP3 container is parseable.
 *
 * <p>An optional ID3v2 tag is skipped at the start and an ID3v1 tag is tolerated at
 * the end. Every frame must follow the previous one directly.
 */
public final class Mp3FrameScanner {

    private static final int[] BITRATES_V1 = {0, 32, 40, 48, 56, 64, 80, 96, 112, 128, 160, 192, 224, 256, 320};
    private static final int[] BITRATES_V2 = {0, 8, 16, 24, 32, 40, 48, 56, 64, 80, 96, 112, 128, 144, 160};
    private static final int[][] SAMPLE_RATES = {
            {11025, 12000, 8000},   // MPEG 2.5
            null,                   // reserved
            {22050, 24000, 16000},  // MPEG 2
            {44100, 48000, 32000}   // MPEG 1
    };

    private static final int ID3V1_LENGTH = 128;

    private Mp3FrameScanner() {
    }

    public static Optional<Mp3Info> scan(Path file) throws IOException {
        return scan(Files.readAllBytes(file));
    }

    public static Optional<Mp3Info> scan(byte[] data) {
        int pos = skipId3v2(data);
        int end = data.length;
        if (end - pos >= ID3V1_LENGTH && data[end - ID3V1_LENGTH] == 'T'
                && data[end - ID3V1_LENGTH + 1] == 'A' && data[end - ID3V1_LENGTH + 2] == 'G') {
            end -= ID3V1_LENGTH;
        }

        int frames = 0;
        long samples = 0;
        int sampleRate = 0;

        while (end - pos >= 4) {
            Frame frame = parseHeader(data, pos);
            if (frame == null) {
                break;
            }
            if (frames == 0) {
                sampleRate = frame.sampleRate;
            } else if (frame.sampleRate != sampleRate) {
                break;
            }
            frames++;
            samples += frame.samples;
            pos += frame.length;
        }

        // Truncated last frames and trailing junk are tolerated once a run of frames is established
        boolean complete = pos >= end;
        if (frames == 0 || (!complete && frames < 2)) {
            return Optional.empty();
        }
        return Optional.of(new Mp3Info(frames, sampleRate, (double) samples / sampleRate));
    }

    private static int skipId3v2(byte[] data) {
        if (data.length < 10 || data[0] != 'I' || data[1] != 'D' || data[2] != '3') {
            return 0;
        }
        int size = ((data[6] & 0x7F) << 21) | ((data[7] & 0x7F) << 14)
                | ((data[8] & 0x7F) << 7) | (data[9] & 0x7F);
        boolean footer = (data[5] & 0x10) != 0;
        return Math.min(data.length, 10 + size + (footer ? 10 : 0));
    }

    private static Frame parseHeader(byte[] data, int pos) {
        int b1 = data[pos + 1] & 0xFF;
        int b2 = data[pos + 2] & 0xFF;
        if ((data[pos] & 0xFF) != 0xFF || (b1 & 0xE0) != 0xE0) {
            return null;
        }
        int version = (b1 >> 3) & 0x03;
        int layer = (b1 >> 1) & 0x03;
        int bitrateIndex = (b2 >> 4) & 0x0F;
        int sampleRateIndex = (b2 >> 2) & 0x03;
        int padding = (b2 >> 1) & 0x01;

        if (version == 1 || layer != 1 || bitrateIndex == 0 || bitrateIndex == 15 || sampleRateIndex == 3) {
            return null;
        }

        boolean mpeg1 = version == 3;
        int bitrate = (mpeg1 ? BITRATES_V1 : BITRATES_V2)[bitrateIndex] * 1000;
        int sampleRate = SAMPLE_RATES[version][sampleRateIndex];
        int samples = mpeg1 ? 1152 : 576;
        int length = (mpeg1 ? 144 : 72) * bitrate / sampleRate + padding;
        return new Frame(length, sampleRate, samples);
    }

    private record Frame(int length, int sampleRate, int samples) {
    }
}
