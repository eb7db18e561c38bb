package com.libragraph.chatmedia.core.model;

import com.libragraph.chatmedia.types.AttachmentVariant;
import com.libragraph.chatmedia.types.MediaKind;
import com.libragraph.chatmedia.util.ContentId;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * One unit of resolution work. Lives only in memory.
 * <p>
 * State moves {@code PENDING -> RUNNING -> SUCCEEDED | FAILED}; terminal states are final.
 */
public class PipelineTask {

    private final ContentId key;
    private final MediaKind kind;
    private volatile List<Path> sourceCandidates = List.of();
    private volatile TaskState state = TaskState.PENDING;
    private volatile AttachmentVariant attemptedVariant;

    public PipelineTask(ContentId key, MediaKind kind) {
        this.key = Objects.requireNonNull(key);
        this.kind = Objects.requireNonNull(kind);
    }

    public ContentId key() {
        return key;
    }

    public MediaKind kind() {
        return kind;
    }

    public List<Path> sourceCandidates() {
        return sourceCandidates;
    }

    public void sourceCandidates(List<Path> candidates) {
        this.sourceCandidates = List.copyOf(candidates);
    }

    public TaskState state() {
        return state;
    }

    public AttachmentVariant attemptedVariant() {
        return attemptedVariant;
    }

    public void attempt(AttachmentVariant variant) {
        this.attemptedVariant = variant;
    }

    public synchronized void markRunning() {
        if (state == TaskState.PENDING) {
            state = TaskState.RUNNING;
        }
    }

    public synchronized boolean markSucceeded() {
        return finish(TaskState.SUCCEEDED);
    }

    public synchronized boolean markFailed() {
        return finish(TaskState.FAILED);
    }

    private boolean finish(TaskState terminal) {
        if (state.isTerminal()) {
            return false;
        }
        state = terminal;
        return true;
    }

    @Override
    public String toString() {
        return kind.label() + ":" + key + "[" + state + "]";
    }
}
