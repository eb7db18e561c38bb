package com.libragraph.chatmedia.core.pipeline;

import com.libragraph.chatmedia.core.service.ManagedService;

/**
 * Snapshot of pipeline state for diagnostics and health checks.
 */
public record PipelineStatus(
        ManagedService.State coordinator,
        ManagedService.State encoders,
        int poolSize,
        long executions,
        int inFlight,
        int cachedOutputs,
        boolean xorKeyConfigured,
        boolean aesKeyConfigured
) {
    public boolean ready() {
        return coordinator == ManagedService.State.RUNNING && encoders == ManagedService.State.RUNNING;
    }
}
