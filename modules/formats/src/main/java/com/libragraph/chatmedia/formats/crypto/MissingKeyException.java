package com.libragraph.chatmedia.formats.crypto;

/**
 * Thrown when a blob needs a key that is not configured.
 */
public class MissingKeyException extends DatDecryptionException {

    public MissingKeyException(String message) {
        super(message);
    }
}
