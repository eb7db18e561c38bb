package com.libragraph.chatmedia.formats.audio;

import javax.sound.sampled.AudioFormat;

/**
 * Raw signed little-endian PCM layout.
 *
 * @param sampleRate    samples per second
 * @param channels      channel count
 * @param bitsPerSample bits per sample
 */
public record PcmFormat(int sampleRate, int channels, int bitsPerSample) {

    /** What the speech decoder emits: s16le, 24 kHz, mono. */
    public static final PcmFormat VOICE = new PcmFormat(24000, 1, 16);

    public PcmFormat {
        if (sampleRate <= 0 || channels <= 0 || bitsPerSample <= 0 || bitsPerSample % 8 != 0) {
            throw new IllegalArgumentException("Invalid PCM format: " + sampleRate + "/" + channels + "/" + bitsPerSample);
        }
    }

    public int bytesPerFrame() {
        return channels * bitsPerSample / 8;
    }

    public int bytesPerSecond() {
        return sampleRate * bytesPerFrame();
    }

    public double durationSeconds(long pcmBytes) {
        return (double) pcmBytes / bytesPerSecond();
    }

    public AudioFormat toAudioFormat() {
        return new AudioFormat(sampleRate, bitsPerSample, channels, true, false);
    }
}
