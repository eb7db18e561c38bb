package com.libragraph.chatmedia.core.variant;

import com.libragraph.chatmedia.core.error.ErrorKind;
import com.libragraph.chatmedia.core.error.PipelineException;
import com.libragraph.chatmedia.types.AttachmentVariant;
import com.libragraph.chatmedia.util.ContentId;
import com.libragraph.chatmedia.util.VariantName;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Maps a content identifier to the variant files present under the account root.
 *
 * <p>The account root is scanned once, lazily, by the first caller; concurrent callers
 * wait for that scan. Candidates are ordered by variant rank. When two files share a
 * key and variant, the lexicographically first path wins.
 */
public class VariantResolver {

    private static final Logger LOG = Logger.getLogger(VariantResolver.class);

    private final Path accountRoot;
    private final AtomicReference<CompletableFuture<Map<String, Map<AttachmentVariant, Path>>>> index =
            new AtomicReference<>();
    private final AtomicInteger scans = new AtomicInteger();

    /**
     * @param accountRoot directory holding dat blobs, or null if none is configured
     */
    public VariantResolver(Path accountRoot) {
        this.accountRoot = accountRoot;
    }

    /**
     * Candidates for a single identifier.
     */
    public List<VariantCandidate> candidates(ContentId id) {
        return candidates(List.of(id.value()));
    }

    /**
     * Candidates for several probe names, merged and ordered by rank.
     * Earlier names win when two names yield the same variant.
     */
    public List<VariantCandidate> candidates(List<String> probeNames) {
        Map<String, Map<AttachmentVariant, Path>> byKey = index();
        Map<AttachmentVariant, Path> merged = new EnumMap<>(AttachmentVariant.class);
        for (String name : probeNames) {
            Map<AttachmentVariant, Path> found = byKey.get(ContentId.ofName(name).value());
            if (found != null) {
                found.forEach(merged::putIfAbsent);
            }
        }

        List<VariantCandidate> result = new ArrayList<>(merged.size());
        merged.forEach((variant, path) -> result.add(new VariantCandidate(variant, path)));
        result.sort((a, b) -> AttachmentVariant.BY_PREFERENCE.compare(a.variant(), b.variant()));
        return result;
    }

    /** Drops the index; the next lookup rescans. */
    public void refresh() {
        index.set(null);
    }

    /** Number of scans performed so far. */
    public int scanCount() {
        return scans.get();
    }

    private Map<String, Map<AttachmentVariant, Path>> index() {
        while (true) {
            CompletableFuture<Map<String, Map<AttachmentVariant, Path>>> current = index.get();
            if (current == null) {
                CompletableFuture<Map<String, Map<AttachmentVariant, Path>>> mine = new CompletableFuture<>();
                if (!index.compareAndSet(null, mine)) {
                    continue;
                }
                try {
                    mine.complete(scan());
                } catch (RuntimeException e) {
                    index.compareAndSet(mine, null);
                    mine.completeExceptionally(e);
                }
                current = mine;
            }
            try {
                return current.join();
            } catch (CompletionException e) {
                if (e.getCause() instanceof PipelineException pe) {
                    throw pe;
                }
                throw new PipelineException(ErrorKind.SOURCE_MISSING,
                        "Account root scan failed: " + accountRoot, e.getCause());
            }
        }
    }

    private Map<String, Map<AttachmentVariant, Path>> scan() {
        scans.incrementAndGet();
        if (accountRoot == null || !Files.isDirectory(accountRoot)) {
            LOG.debugf("No account root to scan (%s)", accountRoot);
            return Collections.emptyMap();
        }

        long start = System.nanoTime();
        Map<String, Map<AttachmentVariant, Path>> result = new HashMap<>();
        int files = 0;
        try (Stream<Path> walk = Files.walk(accountRoot)) {
            for (Path path : (Iterable<Path>) walk.filter(Files::isRegularFile)::iterator) {
                VariantName name = VariantName.parse(path.getFileName().toString());
                if (name.extension().isEmpty() || name.base().isEmpty()) {
                    continue;
                }
                files++;
                result.computeIfAbsent(name.base(), k -> new EnumMap<>(AttachmentVariant.class))
                        .merge(name.variant(), path,
                                (existing, candidate) -> existing.toString().compareTo(candidate.toString()) <= 0
                                        ? existing : candidate);
            }
        } catch (IOException | UncheckedIOException e) {
            throw new PipelineException(ErrorKind.SOURCE_MISSING, "Cannot scan account root " + accountRoot, e);
        }

        LOG.infof("Indexed %d source files (%d keys) under %s in %d ms",
                files, result.size(), accountRoot, (System.nanoTime() - start) / 1_000_000);
        return result;
    }
}
