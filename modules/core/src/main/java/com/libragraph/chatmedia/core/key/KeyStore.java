package com.libragraph.chatmedia.core.key;

import com.libragraph.chatmedia.formats.crypto.KeySet;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Holds the decryption keys for one account.
 *
 * <p>The XOR key is given as hex; an optional {@code 0x} prefix is stripped and the
 * first byte is used. The AES key is either 32 hex characters or an ASCII string of
 * at least 16 characters, of which the first 16 are used.
 */
public final class KeyStore {

    private static final Logger LOG = Logger.getLogger(KeyStore.class);

    private final KeySet keys;

    public KeyStore(KeySet keys) {
        this.keys = keys;
    }

    public static KeyStore empty() {
        return new KeyStore(KeySet.EMPTY);
    }

    /**
     * Parses configured key strings; blank values count as absent.
     *
     * @throws IllegalArgumentException if a present key is malformed
     */
    public static KeyStore parse(Optional<String> xorKey, Optional<String> aesKey) {
        Byte xor = xorKey.filter(s -> !s.isBlank()).map(KeyStore::parseXorKey).orElse(null);
        byte[] aes = aesKey.filter(s -> !s.isBlank()).map(KeyStore::parseAesKey).orElse(null);
        KeySet keys = new KeySet(xor, aes);
        LOG.infof("Key store initialized: %s", keys);
        return new KeyStore(keys);
    }

    public static byte parseXorKey(String value) {
        String hex = value.trim();
        if (hex.startsWith("0x") || hex.startsWith("0X")) {
            hex = hex.substring(2);
        }
        if (hex.length() < 2) {
            throw new IllegalArgumentException("XOR key needs at least two hex digits");
        }
        try {
            return (byte) Integer.parseInt(hex.substring(0, 2), 16);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("XOR key is not hex", e);
        }
    }

    public static byte[] parseAesKey(String value) {
        String key = value.trim();
        if (key.length() == 32 && key.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
            return HexFormat.of().parseHex(key);
        }
        if (key.length() < KeySet.AES_KEY_LENGTH) {
            throw new IllegalArgumentException("AES key needs 32 hex digits or at least 16 characters");
        }
        return key.substring(0, KeySet.AES_KEY_LENGTH).getBytes(StandardCharsets.US_ASCII);
    }

    public KeySet keys() {
        return keys;
    }

    public boolean hasXorKey() {
        return keys.hasXorKey();
    }

    public boolean hasAesKey() {
        return keys.hasAesKey();
    }
}
