package com.libragraph.chatmedia.core.voice;

import com.libragraph.chatmedia.core.error.ErrorKind;
import com.libragraph.chatmedia.core.error.PipelineException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the external speech decoder: {@code decoder <input> <output> -Fs_API <rate>}.
 * Output is raw s16le mono PCM at the requested rate.
 */
public class SilkDecoder {

    private static final Logger LOG = Logger.getLogger(SilkDecoder.class);
    private static final int LOG_TAIL = 512;

    private final DecoderLocator locator;
    private final Duration timeout;

    public SilkDecoder(DecoderLocator locator, Duration timeout) {
        this.locator = locator;
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Decodes {@code input} into {@code pcmOutput}. Decoder output goes to a log file
     * next to the PCM output.
     *
     * @throws PipelineException DECODE_FAILED on nonzero exit or missing output,
     *                           TIMEOUT if the decoder overruns or the thread is interrupted
     */
    public void decode(Path input, Path pcmOutput, int sampleRate) {
        Path decoder = locator.locate();
        Path logFile = pcmOutput.resolveSibling(pcmOutput.getFileName() + ".log");
        List<String> command = List.of(decoder.toString(), input.toString(), pcmOutput.toString(),
                "-Fs_API", Integer.toString(sampleRate));

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(logFile.toFile())
                    .start();
        } catch (IOException e) {
            throw new PipelineException(ErrorKind.DECODE_FAILED, "Cannot start decoder " + decoder, e);
        }

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                destroyTree(process);
                throw new PipelineException(ErrorKind.TIMEOUT, "Decoder exceeded " + timeout);
            }
        } catch (InterruptedException e) {
            destroyTree(process);
            Thread.currentThread().interrupt();
            throw new PipelineException(ErrorKind.TIMEOUT, "Decoder interrupted", e);
        }

        int exit = process.exitValue();
        if (exit != 0) {
            throw new PipelineException(ErrorKind.DECODE_FAILED,
                    "Decoder exited with " + exit + ": " + tail(logFile));
        }
        try {
            if (!Files.isRegularFile(pcmOutput) || Files.size(pcmOutput) == 0) {
                throw new PipelineException(ErrorKind.DECODE_FAILED, "Decoder produced no PCM output");
            }
        } catch (IOException e) {
            throw new PipelineException(ErrorKind.DECODE_FAILED, "Cannot read decoder output", e);
        }
        LOG.debugf("Decoded %s into %s", input.getFileName(), pcmOutput.getFileName());
    }

    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(2, TimeUnit.SECONDS)) {
                LOG.warnf("Decoder process %d did not exit after kill", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String tail(Path logFile) {
        try {
            String text = Files.readString(logFile, StandardCharsets.UTF_8).trim();
            return text.length() <= LOG_TAIL ? text : text.substring(text.length() - LOG_TAIL);
        } catch (IOException e) {
            return "(no decoder output)";
        }
    }
}
