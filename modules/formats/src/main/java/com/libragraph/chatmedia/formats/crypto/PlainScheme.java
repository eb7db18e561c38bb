package com.libragraph.chatmedia.formats.crypto;

import com.libragraph.chatmedia.formats.image.ImageSignature;

/**
 * Passthrough for blobs that are already plain images (unencrypted stickers).
 */
public class PlainScheme implements DatScheme {

    @Override
    public String name() {
        return "plain";
    }

    @Override
    public boolean matches(byte[] header) {
        return ImageSignature.isImage(header);
    }

    @Override
    public byte[] decrypt(byte[] data, KeySet keys) {
        return data;
    }
}
