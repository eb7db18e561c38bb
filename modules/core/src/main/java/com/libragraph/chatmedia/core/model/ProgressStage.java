package com.libragraph.chatmedia.core.model;

/**
 * Stages reported through {@link ProgressListener}.
 */
public enum ProgressStage {
    FETCH,
    DECRYPT,
    DECODE,
    ENCODE,
    VALIDATE,
    COMPLETE,
    BATCH
}
