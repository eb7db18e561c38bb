package com.libragraph.chatmedia.core.model;

/**
 * @param stage   stage reporting progress
 * @param current units done (bytes, candidates or references, depending on stage)
 * @param total   units expected, or -1 if unknown
 * @param detail  free-form detail for display
 */
public record ProgressEvent(ProgressStage stage, long current, long total, String detail) {
}
