package com.libragraph.chatmedia.core.health;

import com.libragraph.chatmedia.core.pipeline.MediaPipelineFacade;
import com.libragraph.chatmedia.core.pipeline.PipelineStatus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class PipelineHealthCheck implements HealthCheck {

    @Inject
    MediaPipelineFacade pipeline;

    @Override
    public HealthCheckResponse call() {
        try {
            PipelineStatus status = pipeline.status();
            return HealthCheckResponse.named("media-pipeline")
                    .status(status.ready())
                    .withData("coordinator", status.coordinator().name())
                    .withData("encoders", status.encoders().name())
                    .withData("workers", status.poolSize())
                    .withData("inFlight", status.inFlight())
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("media-pipeline")
                    .down()
                    .withData("error", e.getMessage())
                    .build();
        }
    }
}
