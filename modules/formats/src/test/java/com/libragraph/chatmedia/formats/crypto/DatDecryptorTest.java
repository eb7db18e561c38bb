package com.libragraph.chatmedia.formats.crypto;

import com.libragraph.chatmedia.formats.TestImages;
import com.libragraph.chatmedia.formats.image.ImageSignature;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DatDecryptorTest {

    private static final byte XOR_KEY = 0x37;

    private final DatDecryptor decryptor = new DatDecryptor();

    @Test
    void shouldDecryptXorOnlyWithoutAesKey() {
        byte[] png = TestImages.png();

        DatDecryptor.Decrypted result = decryptor.decrypt(DatFixtures.xor(png, XOR_KEY), KeySet.xorOnly(XOR_KEY));

        assertThat(result.data()).isEqualTo(png);
        assertThat(result.signature()).isEqualTo(ImageSignature.PNG);
        assertThat(result.scheme()).isEqualTo("xor");
    }

    @Test
    void shouldDecryptV1WithBuiltInKey() throws Exception {
        byte[] jpeg = TestImages.jpeg();
        byte[] blob = DatFixtures.blockCipher(BlockCipherScheme.v1().signature(), jpeg, jpeg.length / 2, 100,
                DatFixtures.V1_KEY, XOR_KEY);

        DatDecryptor.Decrypted result = decryptor.decrypt(blob, KeySet.xorOnly(XOR_KEY));

        assertThat(result.data()).isEqualTo(jpeg);
        assertThat(result.scheme()).isEqualTo("aes-v1");
    }

    @Test
    void shouldDecryptV2WithConfiguredKey() throws Exception {
        byte[] png = TestImages.png();
        byte[] blob = DatFixtures.blockCipher(BlockCipherScheme.v2().signature(), png, 37, 20,
                DatFixtures.V2_KEY, XOR_KEY);

        DatDecryptor.Decrypted result = decryptor.decrypt(blob, new KeySet(XOR_KEY, DatFixtures.V2_KEY));

        assertThat(result.data()).isEqualTo(png);
        assertThat(result.scheme()).isEqualTo("aes-v2");
    }

    @Test
    void shouldHandleAlignedAesSizeAndEmptyTail() throws Exception {
        byte[] png = TestImages.png();
        byte[] blob = DatFixtures.blockCipher(BlockCipherScheme.v2().signature(), png, 32, 0,
                DatFixtures.V2_KEY, XOR_KEY);

        DatDecryptor.Decrypted result = decryptor.decrypt(blob, new KeySet(null, DatFixtures.V2_KEY));

        assertThat(result.data()).isEqualTo(png);
    }

    @Test
    void shouldReportMissingKeyForV2BlobWithOnlyXor() throws Exception {
        byte[] blob = DatFixtures.blockCipher(BlockCipherScheme.v2().signature(), TestImages.png(), 64, 10,
                DatFixtures.V2_KEY, XOR_KEY);

        assertThatThrownBy(() -> decryptor.decrypt(blob, KeySet.xorOnly(XOR_KEY)))
                .isInstanceOf(MissingKeyException.class);
    }

    @Test
    void shouldReportMissingKeyWithoutAnyKey() {
        byte[] blob = DatFixtures.xor(TestImages.png(), XOR_KEY);

        assertThatThrownBy(() -> decryptor.decrypt(blob, KeySet.EMPTY))
                .isInstanceOf(MissingKeyException.class);
    }

    @Test
    void shouldFailWithWrongXorKey() {
        byte[] blob = DatFixtures.xor(TestImages.png(), XOR_KEY);

        assertThatThrownBy(() -> decryptor.decrypt(blob, KeySet.xorOnly((byte) 0x11)))
                .isInstanceOf(DatDecryptionException.class)
                .isNotInstanceOf(MissingKeyException.class);
    }

    @Test
    void shouldPassPlainImagesThrough() {
        byte[] gif = TestImages.gif();

        DatDecryptor.Decrypted result = decryptor.decrypt(gif, KeySet.EMPTY);

        assertThat(result.data()).isEqualTo(gif);
        assertThat(result.scheme()).isEqualTo("plain");
    }

    @Test
    void shouldRejectMalformedBlockCipherLengths() throws Exception {
        byte[] blob = DatFixtures.blockCipher(BlockCipherScheme.v1().signature(), TestImages.png(), 64, 10,
                DatFixtures.V1_KEY, XOR_KEY);
        blob[6] = (byte) 0xFF;
        blob[7] = (byte) 0xFF;
        blob[8] = (byte) 0xFF;
        blob[9] = (byte) 0x0F;

        assertThatThrownBy(() -> BlockCipherScheme.v1().decrypt(blob, KeySet.xorOnly(XOR_KEY)))
                .isInstanceOf(DatDecryptionException.class)
                .hasMessageContaining("malformed");
    }

    @Test
    void shouldRoundPaddedLengthUpToNextBlock() {
        assertThat(BlockCipherScheme.paddedLength(0)).isEqualTo(16);
        assertThat(BlockCipherScheme.paddedLength(15)).isEqualTo(16);
        assertThat(BlockCipherScheme.paddedLength(16)).isEqualTo(32);
        assertThat(BlockCipherScheme.paddedLength(17)).isEqualTo(32);
    }
}
