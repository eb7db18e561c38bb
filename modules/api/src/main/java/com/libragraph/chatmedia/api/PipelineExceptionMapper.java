package com.libragraph.chatmedia.api;

import com.libragraph.chatmedia.core.error.ErrorKind;
import com.libragraph.chatmedia.core.error.PipelineError;
import com.libragraph.chatmedia.core.error.PipelineException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import java.util.concurrent.CompletionException;

public class PipelineExceptionMapper {

    private static final Logger LOG = Logger.getLogger(PipelineExceptionMapper.class);

    @ServerExceptionMapper
    public Response handlePipeline(PipelineException e) {
        return toResponse(PipelineError.from(e));
    }

    @ServerExceptionMapper
    public Response handleCompletion(CompletionException e) {
        Throwable cause = PipelineError.unwrap(e);
        if (!(cause instanceof PipelineException)) {
            LOG.errorf(cause, "Unexpected pipeline failure");
        }
        return toResponse(PipelineError.from(cause));
    }

    static int statusFor(ErrorKind kind) {
        return switch (kind) {
            case SOURCE_MISSING, UNRESOLVABLE -> 404;
            case KEY_MISSING -> 412;
            case TIMEOUT -> 504;
            default -> 422;
        };
    }

    private static Response toResponse(PipelineError error) {
        return Response.status(statusFor(error.kind()))
                .type(MediaType.APPLICATION_JSON)
                .entity(ErrorView.of(error))
                .build();
    }
}
