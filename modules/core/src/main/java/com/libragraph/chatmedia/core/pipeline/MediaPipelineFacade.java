package com.libragraph.chatmedia.core.pipeline;

import com.libragraph.chatmedia.core.cache.CacheIndex;
import com.libragraph.chatmedia.core.cache.OutputFiles;
import com.libragraph.chatmedia.core.error.ErrorKind;
import com.libragraph.chatmedia.core.error.PipelineException;
import com.libragraph.chatmedia.core.key.KeyStore;
import com.libragraph.chatmedia.core.model.AttachmentReference;
import com.libragraph.chatmedia.core.model.PipelineTask;
import com.libragraph.chatmedia.core.model.ProgressEvent;
import com.libragraph.chatmedia.core.model.ProgressListener;
import com.libragraph.chatmedia.core.model.ProgressStage;
import com.libragraph.chatmedia.core.model.Resolution;
import com.libragraph.chatmedia.core.model.ResolvedMedia;
import com.libragraph.chatmedia.core.model.TaskState;
import com.libragraph.chatmedia.core.service.ServiceStateChangedEvent;
import com.libragraph.chatmedia.core.task.ConcurrencyCoordinator;
import com.libragraph.chatmedia.core.task.TaskKey;
import com.libragraph.chatmedia.core.validate.MediaValidator;
import com.libragraph.chatmedia.core.variant.VariantCandidate;
import com.libragraph.chatmedia.core.variant.VariantResolver;
import com.libragraph.chatmedia.core.voice.DecoderLocator;
import com.libragraph.chatmedia.core.voice.EncoderMode;
import com.libragraph.chatmedia.core.voice.EncoderPool;
import com.libragraph.chatmedia.core.voice.FilesystemVoiceBlobSource;
import com.libragraph.chatmedia.core.voice.SilkDecoder;
import com.libragraph.chatmedia.core.voice.SpeechTranscoder;
import com.libragraph.chatmedia.core.voice.VoiceBlobSource;
import com.libragraph.chatmedia.formats.crypto.DatDecryptionException;
import com.libragraph.chatmedia.formats.crypto.DatDecryptor;
import com.libragraph.chatmedia.formats.crypto.KeySet;
import com.libragraph.chatmedia.formats.crypto.MissingKeyException;
import com.libragraph.chatmedia.types.MediaKind;
import com.libragraph.chatmedia.util.ContentId;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Entry point for resolving chat attachments into local media files.
 *
 * <p>Images and stickers: every variant candidate is tried in rank order
 * (decrypt, write, validate) and the first usable output wins. A corrupt output is
 * deleted and its source blacklisted for this instance. Voice notes go through the
 * {@link SpeechTranscoder}.
 *
 * <p>All state (indexes, blacklists, pools) belongs to the instance; build one with
 * {@link #builder()} and release it with {@link #close()}.
 */
public class MediaPipelineFacade implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(MediaPipelineFacade.class);

    static final Duration VOICE_GRACE = Duration.ofSeconds(15);

    private final KeyStore keyStore;
    private final VariantResolver variants;
    private final DatDecryptor decryptor;
    private final MediaValidator validator;
    private final CacheIndex cache;
    private final ConcurrencyCoordinator coordinator;
    private final EncoderPool encoders;
    private final SpeechTranscoder transcoder;
    private final Duration taskTimeout;
    private final boolean allowDegraded;
    private final Set<Path> badSources = ConcurrentHashMap.newKeySet();

    private MediaPipelineFacade(Builder b) {
        this.keyStore = b.keyStore;
        this.variants = new VariantResolver(b.accountRoot);
        this.decryptor = new DatDecryptor();
        this.validator = new MediaValidator();
        this.cache = new CacheIndex(b.outputRoot);
        this.coordinator = new ConcurrencyCoordinator(b.poolSize, cache, validator);
        this.encoders = new EncoderPool(b.encoderMode, b.encoderPoolSize);
        DecoderLocator locator = b.decoderLocator != null
                ? b.decoderLocator
                : new DecoderLocator(Optional.ofNullable(b.decoderPath), b.decoderSearchPath, b.decoderExtractDir);
        VoiceBlobSource voiceSource = b.voiceSource != null ? b.voiceSource : new FilesystemVoiceBlobSource(b.voiceRoot);
        this.transcoder = new SpeechTranscoder(voiceSource, new SilkDecoder(locator, b.decodeTimeout), encoders,
                validator, b.encodeTimeout, b.heartbeat, b.outputRoot.resolve(".work"));
        this.taskTimeout = b.taskTimeout;
        this.allowDegraded = b.allowDegraded;

        encoders.setStateListener(b.stateListener);
        coordinator.setStateListener(b.stateListener);
    }

    public static Builder builder() {
        return new Builder();
    }

    private MediaPipelineFacade start() {
        try {
            encoders.start();
            coordinator.start();
        } catch (Exception e) {
            close();
            throw new IllegalStateException("Media pipeline failed to start", e);
        }
        return this;
    }

    // -- single resolution --

    public Uni<ResolvedMedia> resolve(AttachmentReference reference) {
        return resolve(reference, ProgressListener.NONE);
    }

    public Uni<ResolvedMedia> resolve(AttachmentReference reference, ProgressListener listener) {
        return Uni.createFrom().completionStage(() -> resolveAsync(reference, listener));
    }

    /**
     * Resolves one attachment. Concurrent calls for the same attachment share one run.
     * The future fails with a {@link PipelineException} carrying the {@link ErrorKind}.
     */
    public CompletableFuture<ResolvedMedia> resolveAsync(AttachmentReference reference, ProgressListener listener) {
        Objects.requireNonNull(reference, "reference cannot be null");
        ProgressListener progress = listener == null ? ProgressListener.NONE : listener;
        ContentId key = reference.contentId();
        PipelineTask task = new PipelineTask(key, reference.kind());

        if (reference.kind() == MediaKind.VOICE) {
            Duration timeout = transcoder.budget().plus(VOICE_GRACE);
            return coordinator.resolve(task, timeout, t -> resolveVoice(reference, t, progress));
        }
        return coordinator.resolve(task, taskTimeout, t -> resolveImage(reference, t, progress));
    }

    // -- batch resolution --

    public Uni<Map<AttachmentReference, Resolution>> resolveBatch(List<AttachmentReference> references,
                                                                 int concurrencyHint,
                                                                 ProgressListener listener) {
        return Uni.createFrom().completionStage(() -> resolveBatchAsync(references, concurrencyHint, listener));
    }

    /**
     * Resolves many attachments. References sharing a kind and content identifier share
     * one run; at most {@code min(concurrencyHint, poolSize)} runs are outstanding.
     * Progress is reported per completed run with {@link ProgressStage#BATCH}, counting
     * references. The result map keeps input order.
     */
    public CompletableFuture<Map<AttachmentReference, Resolution>> resolveBatchAsync(
            List<AttachmentReference> references, int concurrencyHint, ProgressListener listener) {
        ProgressListener progress = listener == null ? ProgressListener.NONE : listener;
        Map<TaskKey, List<AttachmentReference>> groups = new LinkedHashMap<>();
        for (AttachmentReference ref : references) {
            groups.computeIfAbsent(new TaskKey(ref.kind(), ref.contentId()), k -> new ArrayList<>()).add(ref);
        }
        if (groups.isEmpty()) {
            return CompletableFuture.completedFuture(Map.of());
        }

        int limit = Math.max(1, Math.min(concurrencyHint, coordinator.poolSize()));
        LOG.infof("Resolving batch of %d references (%d distinct) with %d outstanding",
                references.size(), groups.size(), limit);
        BatchRun run = new BatchRun(new ArrayList<>(groups.values()), references.size(), progress);
        for (int i = 0; i < Math.min(limit, groups.size()); i++) {
            run.launchNext();
        }
        return run.done.thenApply(v -> {
            Map<AttachmentReference, Resolution> ordered = new LinkedHashMap<>();
            for (AttachmentReference ref : references) {
                ordered.put(ref, run.outcomes.get(ref));
            }
            return ordered;
        });
    }

    private final class BatchRun {
        private final List<List<AttachmentReference>> groups;
        private final int totalReferences;
        private final ProgressListener listener;
        private final Map<AttachmentReference, Resolution> outcomes = new ConcurrentHashMap<>();
        private final AtomicInteger cursor = new AtomicInteger();
        private final AtomicInteger finishedGroups = new AtomicInteger();
        private final AtomicInteger finishedReferences = new AtomicInteger();
        private final CompletableFuture<Void> done = new CompletableFuture<>();

        BatchRun(List<List<AttachmentReference>> groups, int totalReferences, ProgressListener listener) {
            this.groups = groups;
            this.totalReferences = totalReferences;
            this.listener = listener;
        }

        void launchNext() {
            int index = cursor.getAndIncrement();
            if (index >= groups.size()) {
                return;
            }
            List<AttachmentReference> group = groups.get(index);
            CompletableFuture<ResolvedMedia> future;
            try {
                future = resolveAsync(group.get(0), ProgressListener.NONE);
            } catch (RuntimeException e) {
                future = CompletableFuture.failedFuture(e);
            }
            future.whenCompleteAsync((media, error) -> {
                Resolution resolution = error == null ? Resolution.resolved(media) : Resolution.failed(error);
                for (AttachmentReference ref : group) {
                    outcomes.put(ref, resolution);
                }
                int refs = finishedReferences.addAndGet(group.size());
                try {
                    listener.onProgress(new ProgressEvent(ProgressStage.BATCH, refs, totalReferences,
                            group.get(0).contentId().value()));
                } catch (RuntimeException e) {
                    LOG.warnf("Progress listener failed: %s", e.getMessage());
                }
                if (finishedGroups.incrementAndGet() == groups.size()) {
                    done.complete(null);
                } else {
                    launchNext();
                }
            });
        }
    }

    // -- voice --

    /**
     * Decodes a voice note only and reports its duration in seconds.
     */
    public Uni<Double> probeVoiceDuration(AttachmentReference reference) {
        if (reference.kind() != MediaKind.VOICE) {
            return Uni.createFrom().failure(new IllegalArgumentException("Not a voice reference: " + reference.kind()));
        }
        return Uni.createFrom().item(() -> transcoder.probeDurationSeconds(reference))
                .runSubscriptionOn(coordinator.executor());
    }

    private ResolvedMedia resolveVoice(AttachmentReference reference, PipelineTask task, ProgressListener listener) {
        Path target = cache.outputPath(MediaKind.VOICE, task.key(), ".mp3");
        return transcoder.transcode(reference, target, listener, () -> task.state() == TaskState.RUNNING);
    }

    // -- images and stickers --

    private ResolvedMedia resolveImage(AttachmentReference reference, PipelineTask task, ProgressListener listener)
            throws IOException {
        List<VariantCandidate> found = variants.candidates(reference.probeNames());
        if (found.isEmpty()) {
            throw new PipelineException(ErrorKind.SOURCE_MISSING, "No source blob for " + task.key());
        }
        List<VariantCandidate> candidates = new ArrayList<>();
        for (VariantCandidate c : found) {
            if (!badSources.contains(c.path())) {
                candidates.add(c);
            }
        }
        task.sourceCandidates(candidates.stream().map(VariantCandidate::path).toList());
        if (candidates.isEmpty()) {
            throw new PipelineException(ErrorKind.UNRESOLVABLE,
                    "Every variant of " + task.key() + " failed before");
        }

        KeySet keys = keyStore.keys();
        List<String> failures = new ArrayList<>();

        for (int i = 0; i < candidates.size(); i++) {
            VariantCandidate candidate = candidates.get(i);
            if (i > 0 && !allowDegraded) {
                LOG.warnf("Not falling back from %s for %s: degraded results disabled",
                        candidates.get(0).variant(), task.key());
                break;
            }
            task.attempt(candidate.variant());
            listener.onProgress(new ProgressEvent(ProgressStage.DECRYPT, i, candidates.size(),
                    candidate.variant().name()));

            byte[] raw;
            try {
                raw = Files.readAllBytes(candidate.path());
            } catch (IOException e) {
                LOG.warnf("Skipping unreadable %s: %s", candidate.path(), e.getMessage());
                failures.add(candidate.variant() + ": unreadable");
                continue;
            }

            DatDecryptor.Decrypted plain;
            try {
                plain = decryptor.decrypt(raw, keys);
            } catch (MissingKeyException e) {
                throw new PipelineException(ErrorKind.KEY_MISSING,
                        "Decryption key missing for " + task.key() + " (" + candidate.variant() + "): "
                                + e.getMessage(), e);
            } catch (DatDecryptionException e) {
                LOG.warnf("Skipping %s for %s: %s", candidate.variant(), task.key(), e.getMessage());
                badSources.add(candidate.path());
                failures.add(candidate.variant() + ": " + e.getMessage());
                continue;
            }

            Path target = cache.outputPath(task.kind(), task.key(), plain.signature().extension());
            Path part = OutputFiles.partFor(target, candidate.variant().name().toLowerCase(Locale.ROOT));
            try {
                Files.createDirectories(target.getParent());
                Files.write(part, plain.data());
            } catch (IOException e) {
                OutputFiles.deleteQuietly(part);
                LOG.warnf("Could not write output for %s from %s: %s", task.key(), candidate.variant(), e.getMessage());
                failures.add(candidate.variant() + ": write failed (" + e.getMessage() + ")");
                continue;
            }

            listener.onProgress(new ProgressEvent(ProgressStage.VALIDATE, i, candidates.size(),
                    candidate.variant().name()));
            MediaValidator.Validation validation = validator.validate(part, task.kind());
            if (!validation.usable()) {
                OutputFiles.deleteQuietly(part);
                badSources.add(candidate.path());
                failures.add(candidate.variant() + ": corrupt output (" + validation.reason() + ")");
                LOG.warnf("Corrupt output from %s for %s: %s", candidate.path(), task.key(), validation.reason());
                continue;
            }
            publishUnlessAbandoned(task, part, target);

            boolean degraded = i > 0;
            if (degraded) {
                LOG.warnf("Resolved %s from fallback variant %s; better variants were unusable",
                        task.key(), candidate.variant());
            }
            listener.onProgress(new ProgressEvent(ProgressStage.COMPLETE, i + 1, candidates.size(),
                    candidate.variant().name()));
            return new ResolvedMedia(task.key(), task.kind(), target, candidate.variant(),
                    validation.mimeType(), Files.size(target), null, false, degraded);
        }

        throw new PipelineException(ErrorKind.UNRESOLVABLE,
                "No variant of " + task.key() + " is usable: " + String.join("; ", failures));
    }

    /**
     * Moves a validated part file into place, unless the task has already been
     * failed (timed out) by the coordinator, in which case the part is discarded.
     */
    static void publishUnlessAbandoned(PipelineTask task, Path part, Path target) throws IOException {
        if (task.state() != TaskState.RUNNING) {
            OutputFiles.deleteQuietly(part);
            throw new PipelineException(ErrorKind.TIMEOUT, "Abandoned " + task + " before publishing");
        }
        OutputFiles.publish(part, target);
    }

    // -- management --

    /** Drops the source index so new blobs are picked up. */
    public void refreshSources() {
        variants.refresh();
    }

    public PipelineStatus status() {
        return new PipelineStatus(coordinator.state(), encoders.state(), coordinator.poolSize(),
                coordinator.executions(), coordinator.inFlightCount(), cache.size(),
                keyStore.hasXorKey(), keyStore.hasAesKey());
    }

    ConcurrencyCoordinator coordinator() {
        return coordinator;
    }

    CacheIndex cache() {
        return cache;
    }

    @Override
    public void close() {
        try {
            coordinator.stop();
        } catch (Exception e) {
            LOG.warn("Error stopping coordinator", e);
        }
        try {
            encoders.stop();
        } catch (Exception e) {
            LOG.warn("Error stopping encoder pool", e);
        }
    }

    /**
     * Builder for {@link MediaPipelineFacade}. Only the output root is required.
     */
    public static final class Builder {
        private Path outputRoot;
        private Path accountRoot;
        private Path voiceRoot;
        private VoiceBlobSource voiceSource;
        private KeyStore keyStore = KeyStore.empty();
        private int poolSize = ConcurrencyCoordinator.defaultPoolSize(Runtime.getRuntime().availableProcessors());
        private Duration taskTimeout = Duration.ofMinutes(2);
        private Duration decodeTimeout = Duration.ofSeconds(45);
        private Duration encodeTimeout = Duration.ofSeconds(90);
        private Duration heartbeat = Duration.ofSeconds(5);
        private Path decoderPath;
        private List<Path> decoderSearchPath = List.of();
        private Path decoderExtractDir = Path.of(System.getProperty("java.io.tmpdir"), "chatmedia", "bin");
        private DecoderLocator decoderLocator;
        private EncoderMode encoderMode = EncoderMode.POOLED;
        private int encoderPoolSize = 2;
        private boolean allowDegraded = true;
        private Consumer<ServiceStateChangedEvent> stateListener = event -> { };

        private Builder() {
        }

        public Builder outputRoot(Path outputRoot) {
            this.outputRoot = outputRoot;
            return this;
        }

        public Builder accountRoot(Path accountRoot) {
            this.accountRoot = accountRoot;
            return this;
        }

        public Builder voiceRoot(Path voiceRoot) {
            this.voiceRoot = voiceRoot;
            return this;
        }

        public Builder voiceSource(VoiceBlobSource voiceSource) {
            this.voiceSource = voiceSource;
            return this;
        }

        public Builder keyStore(KeyStore keyStore) {
            this.keyStore = Objects.requireNonNull(keyStore);
            return this;
        }

        public Builder keys(KeySet keys) {
            return keyStore(new KeyStore(keys));
        }

        public Builder poolSize(int poolSize) {
            this.poolSize = poolSize;
            return this;
        }

        public Builder taskTimeout(Duration taskTimeout) {
            this.taskTimeout = taskTimeout;
            return this;
        }

        public Builder decodeTimeout(Duration decodeTimeout) {
            this.decodeTimeout = decodeTimeout;
            return this;
        }

        public Builder encodeTimeout(Duration encodeTimeout) {
            this.encodeTimeout = encodeTimeout;
            return this;
        }

        public Builder heartbeat(Duration heartbeat) {
            this.heartbeat = heartbeat;
            return this;
        }

        public Builder decoderPath(Path decoderPath) {
            this.decoderPath = decoderPath;
            return this;
        }

        public Builder decoderSearchPath(List<Path> decoderSearchPath) {
            this.decoderSearchPath = List.copyOf(decoderSearchPath);
            return this;
        }

        public Builder decoderExtractDir(Path decoderExtractDir) {
            this.decoderExtractDir = decoderExtractDir;
            return this;
        }

        public Builder decoderLocator(DecoderLocator decoderLocator) {
            this.decoderLocator = decoderLocator;
            return this;
        }

        public Builder encoderMode(EncoderMode encoderMode) {
            this.encoderMode = Objects.requireNonNull(encoderMode);
            return this;
        }

        public Builder encoderPoolSize(int encoderPoolSize) {
            this.encoderPoolSize = encoderPoolSize;
            return this;
        }

        public Builder allowDegraded(boolean allowDegraded) {
            this.allowDegraded = allowDegraded;
            return this;
        }

        public Builder stateListener(Consumer<ServiceStateChangedEvent> stateListener) {
            this.stateListener = Objects.requireNonNull(stateListener);
            return this;
        }

        /**
         * Builds and starts the pipeline.
         */
        public MediaPipelineFacade build() {
            Objects.requireNonNull(outputRoot, "outputRoot is required");
            return new MediaPipelineFacade(this).start();
        }
    }
}
