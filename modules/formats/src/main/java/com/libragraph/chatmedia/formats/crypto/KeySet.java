package com.libragraph.chatmedia.formats.crypto;

import java.util.Arrays;
import java.util.Objects;

/**
 * Decryption keys for dat blobs. Either key may be absent.
 *
 * @param xorKey single-byte XOR key, or null if not configured
 * @param aesKey 16-byte AES key, or null if not configured
 */
public record KeySet(Byte xorKey, byte[] aesKey) {

    public static final int AES_KEY_LENGTH = 16;

    public static final KeySet EMPTY = new KeySet(null, null);

    public KeySet {
        if (aesKey != null) {
            if (aesKey.length != AES_KEY_LENGTH) {
                throw new IllegalArgumentException("AES key must be 16 bytes, got " + aesKey.length);
            }
            aesKey = Arrays.copyOf(aesKey, aesKey.length);
        }
    }

    public static KeySet xorOnly(byte xorKey) {
        return new KeySet(xorKey, null);
    }

    public boolean hasXorKey() {
        return xorKey != null;
    }

    public boolean hasAesKey() {
        return aesKey != null;
    }

    @Override
    public byte[] aesKey() {
        return aesKey == null ? null : Arrays.copyOf(aesKey, aesKey.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeySet other)) return false;
        return Objects.equals(xorKey, other.xorKey) && Arrays.equals(aesKey, other.aesKey);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(xorKey) + Arrays.hashCode(aesKey);
    }

    @Override
    public String toString() {
        return "KeySet[xor=" + (hasXorKey() ? "set" : "absent")
                + ", aes=" + (hasAesKey() ? "set" : "absent") + "]";
    }
}
