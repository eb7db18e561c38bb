package com.libragraph.chatmedia.core.task;

import com.libragraph.chatmedia.core.model.PipelineTask;
import com.libragraph.chatmedia.core.model.ResolvedMedia;

/**
 * The heavy part of a resolution, run on a coordinator worker.
 * Implementations must return only validated outputs.
 */
@FunctionalInterface
public interface PipelineWork {

    ResolvedMedia execute(PipelineTask task) throws Exception;
}
