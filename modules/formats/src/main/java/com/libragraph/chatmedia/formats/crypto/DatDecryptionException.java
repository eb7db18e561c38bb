package com.libragraph.chatmedia.formats.crypto;

/**
 * Thrown when a dat blob cannot be turned into a recognizable image.
 */
public class DatDecryptionException extends RuntimeException {

    public DatDecryptionException(String message) {
        super(message);
    }

    public DatDecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
