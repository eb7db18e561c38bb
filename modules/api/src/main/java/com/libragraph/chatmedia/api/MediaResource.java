package com.libragraph.chatmedia.api;

import com.libragraph.chatmedia.core.model.AttachmentReference;
import com.libragraph.chatmedia.core.pipeline.MediaPipelineFacade;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves chat attachments into local files. Failures are mapped to HTTP status codes by
 * {@link PipelineExceptionMapper}.
 */
@Path("/api/media")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class MediaResource {

    private static final Logger LOG = Logger.getLogger(MediaResource.class);

    @Inject
    MediaPipelineFacade pipeline;

    @ConfigProperty(name = "chatmedia.batch.default-concurrency", defaultValue = "4")
    int defaultConcurrency;

    @POST
    @Path("/resolve")
    public Uni<MediaView> resolve(ResolveRequest request) {
        AttachmentReference ref = toReference(request);
        LOG.debugf("Resolve %s %s", ref.kind().label(), ref.contentId());
        return pipeline.resolve(ref).map(MediaView::of);
    }

    @POST
    @Path("/batch")
    public Uni<List<BatchItem>> batch(BatchRequest request) {
        if (request == null || request.references() == null) {
            throw new BadRequestException("references are required");
        }
        List<AttachmentReference> refs = new ArrayList<>(request.references().size());
        for (ResolveRequest r : request.references()) {
            refs.add(toReference(r));
        }
        int concurrency = request.concurrency() == null ? defaultConcurrency : request.concurrency();
        return pipeline.resolveBatch(refs, concurrency, null).map(results -> {
            List<BatchItem> items = new ArrayList<>(refs.size());
            for (AttachmentReference ref : refs) {
                items.add(BatchItem.of(ref, results.get(ref)));
            }
            return items;
        });
    }

    private static AttachmentReference toReference(ResolveRequest request) {
        if (request == null) {
            throw new BadRequestException("request body is required");
        }
        try {
            return request.toReference();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new BadRequestException(e.getMessage());
        }
    }
}
