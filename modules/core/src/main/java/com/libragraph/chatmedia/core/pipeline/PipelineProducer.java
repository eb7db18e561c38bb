package com.libragraph.chatmedia.core.pipeline;

import com.libragraph.chatmedia.core.key.KeyStore;
import com.libragraph.chatmedia.core.service.ServiceStateChangedEvent;
import com.libragraph.chatmedia.core.task.ConcurrencyCoordinator;
import com.libragraph.chatmedia.core.voice.EncoderMode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Builds the application's {@link MediaPipelineFacade} from configuration.
 */
@ApplicationScoped
public class PipelineProducer {

    private static final Logger LOG = Logger.getLogger(PipelineProducer.class);

    @ConfigProperty(name = "chatmedia.output.root", defaultValue = "${user.home}/.chatmedia/media")
    String outputRoot;

    @ConfigProperty(name = "chatmedia.source.account-root")
    Optional<String> accountRoot;

    @ConfigProperty(name = "chatmedia.source.voice-root")
    Optional<String> voiceRoot;

    @ConfigProperty(name = "chatmedia.keys.xor")
    Optional<String> xorKey;

    @ConfigProperty(name = "chatmedia.keys.aes")
    Optional<String> aesKey;

    @ConfigProperty(name = "chatmedia.pool.size")
    Optional<Integer> poolSize;

    @ConfigProperty(name = "chatmedia.timeouts.task", defaultValue = "PT2M")
    Duration taskTimeout;

    @ConfigProperty(name = "chatmedia.timeouts.decode", defaultValue = "PT45S")
    Duration decodeTimeout;

    @ConfigProperty(name = "chatmedia.timeouts.encode", defaultValue = "PT90S")
    Duration encodeTimeout;

    @ConfigProperty(name = "chatmedia.timeouts.heartbeat", defaultValue = "PT5S")
    Duration heartbeat;

    @ConfigProperty(name = "chatmedia.decoder.path")
    Optional<String> decoderPath;

    @ConfigProperty(name = "chatmedia.decoder.search-path")
    Optional<List<String>> decoderSearchPath;

    @ConfigProperty(name = "chatmedia.decoder.extract-dir", defaultValue = "${java.io.tmpdir}/chatmedia/bin")
    String decoderExtractDir;

    @ConfigProperty(name = "chatmedia.encoder.mode", defaultValue = "POOLED")
    EncoderMode encoderMode;

    @ConfigProperty(name = "chatmedia.encoder.pool-size", defaultValue = "2")
    int encoderPoolSize;

    @ConfigProperty(name = "chatmedia.pipeline.allow-degraded", defaultValue = "true")
    boolean allowDegraded;

    @Inject
    Event<ServiceStateChangedEvent> stateEvent;

    @Produces
    @Singleton
    public MediaPipelineFacade mediaPipeline() {
        int workers = poolSize.orElseGet(() ->
                ConcurrencyCoordinator.defaultPoolSize(Runtime.getRuntime().availableProcessors()));
        LOG.infof("Starting media pipeline: output=%s, account=%s, workers=%d, encoder=%s",
                outputRoot, accountRoot.orElse("(none)"), workers, encoderMode);

        MediaPipelineFacade.Builder builder = MediaPipelineFacade.builder()
                .outputRoot(Path.of(outputRoot))
                .keyStore(KeyStore.parse(xorKey, aesKey))
                .poolSize(workers)
                .taskTimeout(taskTimeout)
                .decodeTimeout(decodeTimeout)
                .encodeTimeout(encodeTimeout)
                .heartbeat(heartbeat)
                .decoderSearchPath(decoderSearchPath.orElse(List.of()).stream().map(Path::of).toList())
                .decoderExtractDir(Path.of(decoderExtractDir))
                .encoderMode(encoderMode)
                .encoderPoolSize(encoderPoolSize)
                .allowDegraded(allowDegraded)
                .stateListener(stateEvent::fire);
        accountRoot.map(Path::of).ifPresent(builder::accountRoot);
        voiceRoot.map(Path::of).ifPresent(builder::voiceRoot);
        decoderPath.map(Path::of).ifPresent(builder::decoderPath);
        return builder.build();
    }

    void close(@Disposes MediaPipelineFacade pipeline) {
        pipeline.close();
    }
}
