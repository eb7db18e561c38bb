package com.libragraph.chatmedia.core.voice;

import com.libragraph.chatmedia.core.cache.OutputFiles;
import com.libragraph.chatmedia.core.error.ErrorKind;
import com.libragraph.chatmedia.core.error.PipelineException;
import com.libragraph.chatmedia.core.model.AttachmentReference;
import com.libragraph.chatmedia.core.model.ProgressEvent;
import com.libragraph.chatmedia.core.model.ProgressListener;
import com.libragraph.chatmedia.core.model.ProgressStage;
import com.libragraph.chatmedia.core.model.ResolvedMedia;
import com.libragraph.chatmedia.core.validate.MediaValidator;
import com.libragraph.chatmedia.formats.audio.Mp3Encoder;
import com.libragraph.chatmedia.formats.audio.PcmFormat;
import com.libragraph.chatmedia.types.MediaKind;
import com.libragraph.chatmedia.util.ContentId;
import org.jboss.logging.Logger;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

/**
 * Turns a voice blob into a playable MP3.
 *
 * <p>Stages run in order {@code FETCH -> DECODE -> ENCODE -> COMPLETE}. Each run gets its
 * own temporary directory under the work root, deleted on every outcome. The MP3 is
 * written to a {@code .part} file, validated, then moved into place.
 */
public class SpeechTranscoder {

    private static final Logger LOG = Logger.getLogger(SpeechTranscoder.class);

    private final VoiceBlobSource source;
    private final SilkDecoder decoder;
    private final EncoderPool encoders;
    private final MediaValidator validator;
    private final PcmFormat pcmFormat;
    private final Duration encodeTimeout;
    private final Duration heartbeat;
    private final Path workRoot;

    public SpeechTranscoder(VoiceBlobSource source, SilkDecoder decoder, EncoderPool encoders,
                            MediaValidator validator, Duration encodeTimeout, Duration heartbeat, Path workRoot) {
        this.source = source;
        this.decoder = decoder;
        this.encoders = encoders;
        this.validator = validator;
        this.pcmFormat = PcmFormat.VOICE;
        this.encodeTimeout = encodeTimeout;
        this.heartbeat = heartbeat;
        this.workRoot = workRoot;
    }

    /** Upper bound for one transcode, excluding scheduling. */
    public Duration budget() {
        return decoder.timeout().plus(encodeTimeout);
    }

    /**
     * Transcodes the voice note into {@code target}.
     */
    public ResolvedMedia transcode(AttachmentReference reference, Path target, ProgressListener listener) {
        return transcode(reference, target, listener, () -> true);
    }

    /**
     * Transcodes the voice note into {@code target}, publishing only if {@code stillWanted}
     * holds once the output is validated. Otherwise the output is discarded and the call
     * fails with {@link ErrorKind#TIMEOUT}.
     */
    public ResolvedMedia transcode(AttachmentReference reference, Path target, ProgressListener listener,
                                   BooleanSupplier stillWanted) {
        ContentId key = reference.contentId();
        Path workDir = createWorkDir();
        Path part = OutputFiles.partFor(target);
        ProgressStage stage = ProgressStage.FETCH;
        try {
            listener.onProgress(new ProgressEvent(stage, 0, 3, key.value()));
            Path blob = fetchBlob(reference, workDir);

            stage = ProgressStage.DECODE;
            listener.onProgress(new ProgressEvent(stage, 1, 3, key.value()));
            Path pcm = workDir.resolve("voice.pcm");
            decoder.decode(blob, pcm, pcmFormat.sampleRate());

            stage = ProgressStage.ENCODE;
            listener.onProgress(new ProgressEvent(stage, 2, 3, key.value()));
            Files.createDirectories(target.getParent());
            encode(pcm, part, listener);

            stage = ProgressStage.VALIDATE;
            MediaValidator.Validation validation = validator.validate(part, MediaKind.VOICE);
            if (!validation.usable()) {
                throw new PipelineException(ErrorKind.CORRUPT_OUTPUT,
                        "Encoded MP3 is unusable: " + validation.reason());
            }
            if (!stillWanted.getAsBoolean()) {
                throw new PipelineException(ErrorKind.TIMEOUT, "Voice " + key + " abandoned before publishing");
            }
            OutputFiles.publish(part, target);

            stage = ProgressStage.COMPLETE;
            listener.onProgress(new ProgressEvent(stage, 3, 3, key.value()));
            LOG.debugf("Transcoded voice %s (%.1fs)", key, validation.durationSeconds());
            return new ResolvedMedia(key, MediaKind.VOICE, target, null, validation.mimeType(),
                    Files.size(target), validation.durationSeconds(), false, false);
        } catch (IOException e) {
            throw new PipelineException(errorKindFor(stage), "I/O failure during " + stage + " of voice " + key, e);
        } finally {
            OutputFiles.deleteQuietly(part);
            OutputFiles.deleteTreeQuietly(workDir);
        }
    }

    /**
     * Decodes the voice note and derives its duration from the PCM length, without encoding.
     */
    public double probeDurationSeconds(AttachmentReference reference) {
        Path workDir = createWorkDir();
        try {
            Path blob = fetchBlob(reference, workDir);
            Path pcm = workDir.resolve("voice.pcm");
            decoder.decode(blob, pcm, pcmFormat.sampleRate());
            return pcmFormat.durationSeconds(Files.size(pcm));
        } catch (IOException e) {
            throw new PipelineException(ErrorKind.DECODE_FAILED,
                    "I/O failure probing voice " + reference.contentId(), e);
        } finally {
            OutputFiles.deleteTreeQuietly(workDir);
        }
    }

    private Path fetchBlob(AttachmentReference reference, Path workDir) throws IOException {
        Optional<byte[]> blob = source.fetch(reference.senderId(), reference.timestamp());
        if (blob.isEmpty()) {
            throw new PipelineException(ErrorKind.SOURCE_MISSING,
                    "No voice blob for " + reference.contentId());
        }
        return Files.write(workDir.resolve("voice.silk"), blob.get());
    }

    private void encode(Path pcm, Path part, ProgressListener listener) {
        long total;
        try {
            total = Files.size(pcm);
        } catch (IOException e) {
            throw new PipelineException(ErrorKind.ENCODE_FAILED, "Cannot read PCM", e);
        }
        AtomicLong consumed = new AtomicLong();
        Mp3Encoder encoder = new Mp3Encoder(pcmFormat);
        Future<Long> job;
        try {
            job = encoders.submit(() -> {
                try (InputStream in = new BufferedInputStream(Files.newInputStream(pcm));
                     OutputStream out = new BufferedOutputStream(Files.newOutputStream(part))) {
                    return encoder.encode(in, out, consumed::set);
                }
            });
        } catch (IllegalStateException | RejectedExecutionException e) {
            throw new PipelineException(ErrorKind.ENCODE_FAILED, "Encoder pool unavailable: " + e.getMessage(), e);
        }

        long deadline = System.nanoTime() + encodeTimeout.toNanos();
        long written;
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    job.cancel(true);
                    throw new PipelineException(ErrorKind.TIMEOUT, "MP3 encoding exceeded " + encodeTimeout);
                }
                try {
                    written = job.get(Math.min(remaining, heartbeat.toNanos()), TimeUnit.NANOSECONDS);
                    break;
                } catch (TimeoutException e) {
                    listener.onProgress(new ProgressEvent(ProgressStage.ENCODE, consumed.get(), total, "encoding"));
                }
            }
        } catch (InterruptedException e) {
            job.cancel(true);
            Thread.currentThread().interrupt();
            throw new PipelineException(ErrorKind.TIMEOUT, "MP3 encoding interrupted", e);
        } catch (CancellationException e) {
            throw new PipelineException(ErrorKind.TIMEOUT, "MP3 encoding cancelled", e);
        } catch (ExecutionException e) {
            throw new PipelineException(ErrorKind.ENCODE_FAILED, "MP3 encoding failed: " + e.getCause(), e.getCause());
        }

        if (written <= 0) {
            throw new PipelineException(ErrorKind.ENCODE_FAILED, "MP3 encoder produced no output");
        }
    }

    private static ErrorKind errorKindFor(ProgressStage stage) {
        if (stage == ProgressStage.FETCH) {
            return ErrorKind.SOURCE_MISSING;
        }
        if (stage == ProgressStage.DECODE) {
            return ErrorKind.DECODE_FAILED;
        }
        return ErrorKind.ENCODE_FAILED;
    }

    private Path createWorkDir() {
        try {
            Files.createDirectories(workRoot);
            return Files.createTempDirectory(workRoot, "voice-");
        } catch (IOException e) {
            throw new PipelineException(ErrorKind.DECODE_FAILED, "Cannot create work directory under " + workRoot, e);
        }
    }
}
