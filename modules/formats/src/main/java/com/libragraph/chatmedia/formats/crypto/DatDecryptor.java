package com.libragraph.chatmedia.formats.crypto;

import com.libragraph.chatmedia.formats.image.ImageSignature;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Auto-detects the encryption scheme of a dat blob and returns the plaintext image.
 *
 * <p>Schemes are tried newest first: AES v2, AES v1, XOR, plain passthrough. The
 * first scheme whose output starts with an image signature wins. Pure; no I/O.
 */
public class DatDecryptor {

    private static final Logger LOG = Logger.getLogger(DatDecryptor.class);

    private final List<DatScheme> schemes;

    public DatDecryptor() {
        this(List.of(BlockCipherScheme.v2(), BlockCipherScheme.v1(), new XorScheme(), new PlainScheme()));
    }

    public DatDecryptor(List<DatScheme> schemes) {
        this.schemes = List.copyOf(schemes);
    }

    /**
     * Result of a successful decryption.
     *
     * @param data      plaintext image bytes
     * @param signature detected image format
     * @param scheme    name of the scheme that produced it
     */
    public record Decrypted(byte[] data, ImageSignature signature, String scheme) {
    }

    /**
     * Decrypts {@code data}.
     *
     * @throws MissingKeyException    if a needed key is absent and no scheme succeeded
     * @throws DatDecryptionException if no scheme produced an image
     */
    public Decrypted decrypt(byte[] data, KeySet keys) {
        MissingKeyException missingKey = null;
        DatDecryptionException lastFailure = null;

        for (DatScheme scheme : schemes) {
            if (!scheme.matches(data)) {
                continue;
            }
            try {
                byte[] plain = scheme.decrypt(data, keys);
                Optional<ImageSignature> signature = ImageSignature.detect(plain);
                if (signature.isPresent()) {
                    LOG.debugf("Decrypted %d bytes with %s as %s", data.length, scheme.name(), signature.get());
                    return new Decrypted(plain, signature.get(), scheme.name());
                }
                LOG.debugf("Scheme %s produced no image signature", scheme.name());
            } catch (MissingKeyException e) {
                LOG.debugf("Scheme %s skipped: %s", scheme.name(), e.getMessage());
                if (missingKey == null) {
                    missingKey = e;
                }
            } catch (DatDecryptionException e) {
                LOG.debugf("Scheme %s failed: %s", scheme.name(), e.getMessage());
                lastFailure = e;
            }
        }

        if (missingKey != null) {
            throw missingKey;
        }
        if (lastFailure != null) {
            throw new DatDecryptionException("No scheme produced an image: " + lastFailure.getMessage(), lastFailure);
        }
        throw new DatDecryptionException("No scheme produced an image");
    }
}
