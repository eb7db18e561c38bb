package com.libragraph.chatmedia.core.key;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class KeyStoreTest {

    @Test
    void shouldParseXorKeyWithPrefix() {
        assertThat(KeyStore.parseXorKey("0x37")).isEqualTo((byte) 0x37);
        assertThat(KeyStore.parseXorKey("0XaF")).isEqualTo((byte) 0xAF);
        assertThat(KeyStore.parseXorKey("a1b2")).isEqualTo((byte) 0xA1);
    }

    @Test
    void shouldRejectMalformedXorKey() {
        assertThatIllegalArgumentException().isThrownBy(() -> KeyStore.parseXorKey("0x"));
        assertThatIllegalArgumentException().isThrownBy(() -> KeyStore.parseXorKey("zz"));
    }

    @Test
    void shouldUseFirstSixteenAsciiCharsOfAesKey() {
        byte[] key = KeyStore.parseAesKey("abcdefghijklmnopqrstuvwxyz");

        assertThat(key).isEqualTo("abcdefghijklmnop".getBytes(StandardCharsets.US_ASCII));
    }

    @Test
    void shouldDecodeHexAesKey() {
        byte[] key = KeyStore.parseAesKey("00112233445566778899aabbccddeeff");

        assertThat(key).hasSize(16);
        assertThat(key[1]).isEqualTo((byte) 0x11);
        assertThat(key[15]).isEqualTo((byte) 0xFF);
    }

    @Test
    void shouldRejectShortAesKey() {
        assertThatIllegalArgumentException().isThrownBy(() -> KeyStore.parseAesKey("short"));
    }

    @Test
    void shouldTreatBlankValuesAsAbsent() {
        KeyStore store = KeyStore.parse(Optional.of(" "), Optional.empty());

        assertThat(store.hasXorKey()).isFalse();
        assertThat(store.hasAesKey()).isFalse();
    }

    @Test
    void shouldBuildKeySet() {
        KeyStore store = KeyStore.parse(Optional.of("0x37"), Optional.of("0123456789abcdef"));

        assertThat(store.keys().xorKey()).isEqualTo((byte) 0x37);
        assertThat(store.hasAesKey()).isTrue();
    }
}
