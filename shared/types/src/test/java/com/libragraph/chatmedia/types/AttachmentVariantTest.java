package com.libragraph.chatmedia.types;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class AttachmentVariantTest {

    @Test
    void shouldOrderByPreference() {
        List<AttachmentVariant> variants = new ArrayList<>(List.of(
                AttachmentVariant.THUMBNAIL, AttachmentVariant.OTHER,
                AttachmentVariant.ORIGINAL, AttachmentVariant.BIG));

        variants.sort(AttachmentVariant.BY_PREFERENCE);

        assertThat(variants).containsExactly(
                AttachmentVariant.BIG, AttachmentVariant.ORIGINAL,
                AttachmentVariant.THUMBNAIL, AttachmentVariant.OTHER);
    }

    @Test
    void shouldMapTagLetters() {
        assertThat(AttachmentVariant.fromTagLetter('b')).isEqualTo(AttachmentVariant.BIG);
        assertThat(AttachmentVariant.fromTagLetter('H')).isEqualTo(AttachmentVariant.HIGH);
        assertThat(AttachmentVariant.fromTagLetter('c')).isEqualTo(AttachmentVariant.CACHE);
        assertThat(AttachmentVariant.fromTagLetter('t')).isEqualTo(AttachmentVariant.THUMBNAIL);
        assertThat(AttachmentVariant.fromTagLetter('x')).isEqualTo(AttachmentVariant.OTHER);
    }

    @Test
    void bigIsPreferredOverOriginal() {
        assertThat(AttachmentVariant.BIG.isPreferredOver(AttachmentVariant.ORIGINAL)).isTrue();
        assertThat(AttachmentVariant.THUMBNAIL.isPreferredOver(AttachmentVariant.CACHE)).isFalse();
    }
}
