package com.libragraph.chatmedia.api;

import java.util.List;

/**
 * @param concurrency requested number of outstanding resolutions; capped by the worker pool
 */
public record BatchRequest(List<ResolveRequest> references, Integer concurrency) {
}
