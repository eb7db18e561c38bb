package com.libragraph.chatmedia.core.voice;

/**
 * How MP3 encode jobs are scheduled.
 */
public enum EncoderMode {
    /** Shared fixed pool of encoder threads. */
    POOLED,
    /** Every encode job runs on its own thread and is never queued. */
    DEDICATED
}
