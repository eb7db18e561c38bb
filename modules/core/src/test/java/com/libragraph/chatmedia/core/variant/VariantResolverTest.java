package com.libragraph.chatmedia.core.variant;

import com.libragraph.chatmedia.types.AttachmentVariant;
import com.libragraph.chatmedia.util.ContentId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;

import static com.libragraph.chatmedia.core.CoreFixtures.write;
import static org.assertj.core.api.Assertions.*;

class VariantResolverTest {

    @TempDir
    Path root;

    @Test
    void shouldOrderCandidatesByRank() {
        write(root.resolve("2024-01"), "abc_t.dat", new byte[]{1});
        write(root.resolve("2024-01"), "abc.dat", new byte[]{1});
        write(root.resolve("2024-02"), "abc_b.dat", new byte[]{1});
        write(root, "other.dat", new byte[]{1});

        List<VariantCandidate> candidates = new VariantResolver(root).candidates(new ContentId("abc"));

        assertThat(candidates).extracting(VariantCandidate::variant).containsExactly(
                AttachmentVariant.BIG, AttachmentVariant.ORIGINAL, AttachmentVariant.THUMBNAIL);
        assertThat(candidates.get(0).path().getFileName().toString()).isEqualTo("abc_b.dat");
    }

    @Test
    void shouldMatchCaseInsensitively() {
        write(root, "ABC_h.dat", new byte[]{1});

        assertThat(new VariantResolver(root).candidates(ContentId.ofName("abc.dat")))
                .extracting(VariantCandidate::variant).containsExactly(AttachmentVariant.HIGH);
    }

    @Test
    void shouldKeepLexicographicallyFirstDuplicate() {
        write(root, "abc_t.dat", new byte[]{1});
        write(root, "abc.t.dat", new byte[]{1});

        List<VariantCandidate> candidates = new VariantResolver(root).candidates(new ContentId("abc"));

        assertThat(candidates).hasSize(1);
        assertThat(candidates.get(0).path().getFileName().toString()).isEqualTo("abc.t.dat");
    }

    @Test
    void shouldMergeProbeNames() {
        write(root, "datname_t.dat", new byte[]{1});
        write(root, "hash123_b.dat", new byte[]{1});

        List<VariantCandidate> candidates = new VariantResolver(root)
                .candidates(List.of("datname.dat", "HASH123"));

        assertThat(candidates).extracting(VariantCandidate::variant)
                .containsExactly(AttachmentVariant.BIG, AttachmentVariant.THUMBNAIL);
    }

    @Test
    void shouldIndexPlainImages() {
        write(root, "sticker.gif", new byte[]{1});
        write(root, "notes.txt", new byte[]{1});

        VariantResolver resolver = new VariantResolver(root);

        assertThat(resolver.candidates(new ContentId("sticker"))).hasSize(1);
        assertThat(resolver.candidates(new ContentId("notes.txt"))).isEmpty();
    }

    @Test
    void shouldScanOnceForConcurrentCallers() throws Exception {
        write(root, "abc.dat", new byte[]{1});
        VariantResolver resolver = new VariantResolver(root);
        CountDownLatch go = new CountDownLatch(1);

        List<CompletableFuture<List<VariantCandidate>>> calls = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            calls.add(CompletableFuture.supplyAsync(() -> {
                try {
                    go.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return resolver.candidates(new ContentId("abc"));
            }));
        }
        go.countDown();

        for (CompletableFuture<List<VariantCandidate>> call : calls) {
            assertThat(call.get()).hasSize(1);
        }
        assertThat(resolver.scanCount()).isEqualTo(1);
    }

    @Test
    void shouldPickUpNewFilesAfterRefresh() {
        VariantResolver resolver = new VariantResolver(root);
        assertThat(resolver.candidates(new ContentId("late"))).isEmpty();

        write(root, "late.dat", new byte[]{1});
        assertThat(resolver.candidates(new ContentId("late"))).isEmpty();

        resolver.refresh();
        assertThat(resolver.candidates(new ContentId("late"))).hasSize(1);
        assertThat(resolver.scanCount()).isEqualTo(2);
    }

    @Test
    void shouldReturnNothingWithoutAccountRoot() {
        assertThat(new VariantResolver(null).candidates(new ContentId("abc"))).isEmpty();
        assertThat(new VariantResolver(root.resolve("missing")).candidates(new ContentId("abc"))).isEmpty();
    }

    @Test
    void shouldIgnoreDirectoriesNamedLikeBlobs() throws Exception {
        Files.createDirectories(root.resolve("abc.dat"));

        assertThat(new VariantResolver(root).candidates(new ContentId("abc"))).isEmpty();
    }
}
