package com.libragraph.chatmedia.formats.audio;

/**
 * Summary of a parsed MP3 stream.
 *
 * @param frames          number of MPEG audio frames
 * @param sampleRate      sample rate of the first frame
 * @param durationSeconds total duration derived from frame headers
 */
public record Mp3Info(int frames, int sampleRate, double durationSeconds) {
}
