package com.libragraph.chatmedia.core;

import javax.crypto.Cipher;
import javax.crypto.spec.SecretKeySpec;
import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Image and dat blob fixtures shared by core tests.
 */
public final class CoreFixtures {

    public static final byte XOR_KEY = 0x37;

    private CoreFixtures() {
    }

    public static byte[] png() {
        return image("png");
    }

    public static byte[] jpeg() {
        return image("jpeg");
    }

    public static byte[] gif() {
        return image("gif");
    }

    /** PNG whose signature is intact but whose body is cut off. */
    public static byte[] truncatedPng() {
        return Arrays.copyOf(png(), 40);
    }

    /** PNG of normal length whose header declares a zero width. */
    public static byte[] zeroWidthPng() {
        byte[] bytes = png();
        Arrays.fill(bytes, 16, 20, (byte) 0);
        return bytes;
    }

    public static byte[] xor(byte[] plain) {
        byte[] out = new byte[plain.length];
        for (int i = 0; i < plain.length; i++) {
            out[i] = (byte) (plain[i] ^ XOR_KEY);
        }
        return out;
    }

    /** Version 2 block cipher blob with no XOR tail. */
    public static byte[] blockCipherV2(byte[] plain, byte[] aesKey) {
        try {
            int aesSize = Math.min(64, plain.length);
            Cipher cipher = Cipher.getInstance("AES/ECB/PKCS5Padding");
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(aesKey, "AES"));
            byte[] aesPart = cipher.doFinal(plain, 0, aesSize);

            ByteBuffer header = ByteBuffer.allocate(15).order(ByteOrder.LITTLE_ENDIAN);
            header.put(new byte[]{0x07, 0x08, 'V', '2', 0x08, 0x07});
            header.putInt(aesSize);
            header.putInt(0);
            header.put((byte) 0);

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            out.write(header.array());
            out.write(aesPart);
            out.write(plain, aesSize, plain.length - aesSize);
            return out.toByteArray();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    public static Path write(Path dir, String name, byte[] bytes) {
        try {
            Files.createDirectories(dir);
            return Files.write(dir.resolve(name), bytes);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static byte[] image(String format) {
        BufferedImage image = new BufferedImage(24, 24, BufferedImage.TYPE_INT_RGB);
        for (int x = 0; x < 24; x++) {
            for (int y = 0; y < 24; y++) {
                image.setRGB(x, y, (x * 10) << 16 | (y * 10) << 8 | 0x80);
            }
        }
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            if (!ImageIO.write(image, format, out)) {
                throw new IllegalStateException("No ImageIO writer for " + format);
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
