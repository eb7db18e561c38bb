package com.libragraph.chatmedia.formats.crypto;

/**
 * Legacy scheme: every byte XOR a single key byte.
 */
public class XorScheme implements DatScheme {

    @Override
    public String name() {
        return "xor";
    }

    @Override
    public boolean matches(byte[] header) {
        return true;
    }

    @Override
    public byte[] decrypt(byte[] data, KeySet keys) {
        if (!keys.hasXorKey()) {
            throw new MissingKeyException("XOR key not configured");
        }
        return xor(data, 0, data.length, keys.xorKey());
    }

    static byte[] xor(byte[] data, int offset, int length, byte key) {
        byte[] out = new byte[length];
        for (int i = 0; i < length; i++) {
            out[i] = (byte) (data[offset + i] ^ key);
        }
        return out;
    }
}
