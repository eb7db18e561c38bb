package com.libragraph.chatmedia.formats.audio;

import de.sciss.jump3r.lowlevel.LameEncoder;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CancellationException;
import java.util.function.LongConsumer;

/**
 * In-process PCM to MP3 encoder backed by jump3r (a Java port of LAME).
 *
 * <p>PCM is streamed in chunks aligned to whole sample frames, followed by a final
 * flush. The encoder checks the calling thread's interrupt flag between chunks so a
 * timed-out job stops promptly. Instances are single use per call and not shared.
 */
public class Mp3Encoder {

    private static final Logger LOG = Logger.getLogger(Mp3Encoder.class);

    private final PcmFormat format;

    public Mp3Encoder(PcmFormat format) {
        this.format = format;
    }

    /**
     * Encodes all PCM from {@code pcm} into {@code mp3}.
     *
     * @param progress receives the number of PCM bytes consumed after each chunk
     * @return number of MP3 bytes written
     * @throws CancellationException if the calling thread is interrupted
     */
    public long encode(InputStream pcm, OutputStream mp3, LongConsumer progress) throws IOException {
        LameEncoder encoder = new LameEncoder(format.toAudioFormat());
        try {
            int frameBytes = format.bytesPerFrame();
            int chunkSize = Math.max(frameBytes, encoder.getPCMBufferSize() / frameBytes * frameBytes);
            byte[] input = new byte[chunkSize];
            byte[] output = new byte[encoder.getMP3BufferSize()];

            long consumed = 0;
            long written = 0;
            int read;
            while ((read = pcm.readNBytes(input, 0, chunkSize)) > 0) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException("MP3 encoding interrupted after " + consumed + " PCM bytes");
                }
                int aligned = read - read % frameBytes;
                if (aligned > 0) {
                    int n = encoder.encodeBuffer(input, 0, aligned, output);
                    if (n > 0) {
                        mp3.write(output, 0, n);
                        written += n;
                    }
                }
                consumed += read;
                progress.accept(consumed);
            }

            int n = encoder.encodeFinish(output);
            if (n > 0) {
                mp3.write(output, 0, n);
                written += n;
            }
            mp3.flush();
            LOG.debugf("Encoded %d PCM bytes into %d MP3 bytes", consumed, written);
            return written;
        } finally {
            encoder.close();
        }
    }
}
