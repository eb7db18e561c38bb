package com.libragraph.chatmedia.formats.crypto;

import javax.crypto.Cipher;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;

/**
 * Newer scheme: AES-128-ECB head, raw middle, XOR tail.
 *
 * <p>Layout:
 * <pre>
 *   0..5   signature
 *   6..9   aesSize  (int32 LE, plaintext length of the AES part)
 *   10..13 xorSize  (int32 LE)
 *   14     reserved
 *   15..   AES part (aesSize rounded up to the next 16-byte block, PKCS#7 padded)
 *          raw middle
 *          XOR tail (xorSize bytes)
 * </pre>
 *
 * <p>Version 1 blobs use a fixed built-in key; version 2 blobs need the configured key.
 */
public class BlockCipherScheme implements DatScheme {

    static final int HEADER_LENGTH = 15;
    private static final int BLOCK = 16;

    private static final byte[] SIGNATURE_V1 = {0x07, 0x08, 'V', '1', 0x08, 0x07};
    private static final byte[] SIGNATURE_V2 = {0x07, 0x08, 'V', '2', 0x08, 0x07};
    private static final byte[] BUILT_IN_KEY = "cfcd208495d565ef".getBytes(StandardCharsets.US_ASCII);

    private final String name;
    private final byte[] signature;
    private final boolean builtInKey;

    private BlockCipherScheme(String name, byte[] signature, boolean builtInKey) {
        this.name = name;
        this.signature = signature;
        this.builtInKey = builtInKey;
    }

    public static BlockCipherScheme v1() {
        return new BlockCipherScheme("aes-v1", SIGNATURE_V1, true);
    }

    public static BlockCipherScheme v2() {
        return new BlockCipherScheme("aes-v2", SIGNATURE_V2, false);
    }

    /** Header signature of this version. */
    public byte[] signature() {
        return signature.clone();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean matches(byte[] header) {
        if (header.length < signature.length) {
            return false;
        }
        return Arrays.equals(header, 0, signature.length, signature, 0, signature.length);
    }

    @Override
    public byte[] decrypt(byte[] data, KeySet keys) {
        byte[] key = builtInKey ? BUILT_IN_KEY : keys.aesKey();
        if (key == null) {
            throw new MissingKeyException(name + " blob needs an AES key");
        }
        if (data.length < HEADER_LENGTH) {
            throw new DatDecryptionException(name + " blob shorter than its header");
        }

        ByteBuffer header = ByteBuffer.wrap(data, 0, HEADER_LENGTH).order(ByteOrder.LITTLE_ENDIAN);
        int aesSize = header.getInt(6);
        int xorSize = header.getInt(10);
        long payload = (long) data.length - HEADER_LENGTH;
        long alignedAes = paddedLength(aesSize);

        if (aesSize < 0 || xorSize < 0 || alignedAes > payload || xorSize > payload - alignedAes) {
            throw new DatDecryptionException(String.format(
                    "%s blob has malformed lengths: aes=%d xor=%d payload=%d", name, aesSize, xorSize, payload));
        }
        if (xorSize > 0 && !keys.hasXorKey()) {
            throw new MissingKeyException(name + " blob has an XOR tail but no XOR key is configured");
        }

        byte[] head = aesDecrypt(data, HEADER_LENGTH, (int) alignedAes, key);
        int middleStart = HEADER_LENGTH + (int) alignedAes;
        int tailStart = data.length - xorSize;

        byte[] out = new byte[head.length + (tailStart - middleStart) + xorSize];
        System.arraycopy(head, 0, out, 0, head.length);
        System.arraycopy(data, middleStart, out, head.length, tailStart - middleStart);
        if (xorSize > 0) {
            byte[] tail = XorScheme.xor(data, tailStart, xorSize, keys.xorKey());
            System.arraycopy(tail, 0, out, out.length - xorSize, xorSize);
        }
        return out;
    }

    /**
     * PKCS#7 length of {@code size} plaintext bytes; an aligned size gains a full block.
     */
    static long paddedLength(int size) {
        return (long) size + (BLOCK - Math.floorMod(size, BLOCK));
    }

    private byte[] aesDecrypt(byte[] data, int offset, int length, byte[] key) {
        try {
            Cipher cipher = Cipher.getInstance("AES/ECB/PKCS5Padding");
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"));
            return cipher.doFinal(data, offset, length);
        } catch (GeneralSecurityException e) {
            throw new DatDecryptionException(name + " AES part failed to decrypt", e);
        }
    }
}
