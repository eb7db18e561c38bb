package com.libragraph.chatmedia.core.cache;

import com.libragraph.chatmedia.core.model.CacheEntry;
import com.libragraph.chatmedia.core.model.ResolvedMedia;
import com.libragraph.chatmedia.types.AttachmentVariant;
import com.libragraph.chatmedia.types.MediaKind;
import com.libragraph.chatmedia.util.ContentId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static com.libragraph.chatmedia.core.CoreFixtures.write;
import static org.assertj.core.api.Assertions.*;

class CacheIndexTest {

    @TempDir
    Path root;

    @Test
    void shouldLayOutOutputsByKind() {
        CacheIndex index = new CacheIndex(root);
        ContentId key = new ContentId("abc");

        assertThat(index.outputPath(MediaKind.IMAGE, key, ".png")).isEqualTo(root.resolve("images/abc.png"));
        assertThat(index.outputPath(MediaKind.VOICE, key, ".mp3")).isEqualTo(root.resolve("voices/abc.mp3"));
        assertThat(index.outputPath(MediaKind.STICKER, key, ".gif")).isEqualTo(root.resolve("emojis/abc.gif"));
    }

    @Test
    void shouldDiscoverExistingOutputsUnvalidated() {
        write(root.resolve("images"), "abc.png", new byte[]{1});
        write(root.resolve("voices"), "123_9_bob.mp3", new byte[]{1});
        write(root.resolve("images"), "half.png.part", new byte[]{1});

        CacheIndex index = new CacheIndex(root);

        CacheEntry image = index.lookup(MediaKind.IMAGE, new ContentId("abc")).orElseThrow();
        assertThat(image.validated()).isFalse();
        assertThat(image.path()).isEqualTo(root.resolve("images/abc.png"));
        assertThat(index.lookup(MediaKind.VOICE, new ContentId("123_9_bob"))).isPresent();
        assertThat(index.lookup(MediaKind.IMAGE, new ContentId("half"))).isEmpty();
        assertThat(index.size()).isEqualTo(2);
    }

    @Test
    void shouldDropEntriesWhoseFileVanished() throws Exception {
        Path file = write(root.resolve("images"), "abc.png", new byte[]{1});
        CacheIndex index = new CacheIndex(root);
        assertThat(index.lookup(MediaKind.IMAGE, new ContentId("abc"))).isPresent();

        Files.delete(file);

        assertThat(index.lookup(MediaKind.IMAGE, new ContentId("abc"))).isEmpty();
        assertThat(index.size()).isZero();
    }

    @Test
    void shouldKeepFirstRecordedEntry() {
        CacheIndex index = new CacheIndex(root);
        ContentId key = new ContentId("abc");
        CacheEntry first = new CacheEntry(key, MediaKind.IMAGE, root.resolve("images/abc.png"),
                null, "image/png", null, true, false);
        CacheEntry second = new CacheEntry(key, MediaKind.IMAGE, root.resolve("images/abc.jpg"),
                null, "image/jpeg", null, true, false);

        assertThat(index.record(first)).isSameAs(first);
        assertThat(index.record(second)).isSameAs(first);
    }

    @Test
    void shouldReplaceDiscoveredEntryWhenValidated() {
        write(root.resolve("images"), "abc.png", new byte[]{1});
        CacheIndex index = new CacheIndex(root);
        CacheEntry discovered = index.lookup(MediaKind.IMAGE, new ContentId("abc")).orElseThrow();

        CacheEntry validated = index.markValidated(discovered, "image/png", null);

        assertThat(index.lookup(MediaKind.IMAGE, new ContentId("abc"))).contains(validated);
        assertThat(validated.mimeType()).isEqualTo("image/png");
        assertThat(validated.degraded()).isFalse();
    }

    @Test
    void shouldCarryDegradedFlagIntoCachedMedia() {
        CacheIndex index = new CacheIndex(root);
        ContentId key = new ContentId("abc");
        ResolvedMedia media = new ResolvedMedia(key, MediaKind.IMAGE, root.resolve("images/abc.jpg"),
                AttachmentVariant.THUMBNAIL, "image/jpeg", 10, null, false, true);

        CacheEntry recorded = index.record(CacheEntry.of(media));

        assertThat(recorded.degraded()).isTrue();
        assertThat(recorded.toMedia(10).degraded()).isTrue();
        assertThat(recorded.toMedia(10).fromCache()).isTrue();
    }

    @Test
    void shouldScanOnlyOnce() {
        CacheIndex index = new CacheIndex(root);
        for (int i = 0; i < 5; i++) {
            index.lookup(MediaKind.IMAGE, new ContentId("k" + i));
        }
        assertThat(index.scanCount()).isEqualTo(1);
    }

    @Test
    void shouldInvalidate() {
        write(root.resolve("emojis"), "stk.gif", new byte[]{1});
        CacheIndex index = new CacheIndex(root);

        index.invalidate(MediaKind.STICKER, new ContentId("stk"));

        assertThat(index.lookup(MediaKind.STICKER, new ContentId("stk"))).isEmpty();
    }
}
