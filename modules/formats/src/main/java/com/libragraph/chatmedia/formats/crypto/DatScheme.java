package com.libragraph.chatmedia.formats.crypto;

/**
 * One of the dat blob encryption schemes.
 *
 * Schemes are tried in a fixed order by {@link DatDecryptor}; a scheme only
 * transforms bytes and never decides whether the result is a usable image.
 */
public interface DatScheme {

    /** Short name used in logs. */
    String name();

    /**
     * Checks if this scheme applies to a blob starting with {@code header}.
     */
    boolean matches(byte[] header);

    /**
     * Decrypts the whole blob.
     *
     * @throws MissingKeyException    if a key this scheme needs is not configured
     * @throws DatDecryptionException if the blob is malformed for this scheme
     */
    byte[] decrypt(byte[] data, KeySet keys);
}
