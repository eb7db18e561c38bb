package com.libragraph.chatmedia.api;

import com.libragraph.chatmedia.core.pipeline.MediaPipelineFacade;
import com.libragraph.chatmedia.core.pipeline.PipelineStatus;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.LinkedHashMap;
import java.util.Map;

@Path("/api/diagnostic")
@Produces(MediaType.APPLICATION_JSON)
public class DiagnosticResource {

    @ConfigProperty(name = "quarkus.application.name")
    String appName;

    @ConfigProperty(name = "quarkus.application.version")
    String appVersion;

    @ConfigProperty(name = "quarkus.profile", defaultValue = "prod")
    String profile;

    @Inject
    MediaPipelineFacade pipeline;

    @GET
    @Path("/ping")
    public Map<String, String> ping() {
        return Map.of(
                "status", "ok",
                "message", "Media pipeline is running"
        );
    }

    @GET
    @Path("/info")
    public Map<String, Object> info() {
        PipelineStatus status = pipeline.status();
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", appName);
        info.put("version", appVersion);
        info.put("java", System.getProperty("java.version"));
        info.put("profile", profile);
        info.put("poolSize", status.poolSize());
        info.put("executions", status.executions());
        info.put("inFlight", status.inFlight());
        info.put("cachedOutputs", status.cachedOutputs());
        return info;
    }
}
