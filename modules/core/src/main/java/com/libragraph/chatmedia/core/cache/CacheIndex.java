package com.libragraph.chatmedia.core.cache;

import com.libragraph.chatmedia.core.model.CacheEntry;
import com.libragraph.chatmedia.types.MediaKind;
import com.libragraph.chatmedia.util.ContentId;
import com.libragraph.chatmedia.util.FileNames;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Process-local index of resolved outputs.
 *
 * <p>Layout: {@code {outputRoot}/{images|voices|emojis}/{sanitized content id}{ext}}.
 * The index is filled lazily by one scan of those directories; concurrent callers
 * share the in-flight scan. Partial ({@code *.part}) files are ignored.
 */
public class CacheIndex {

    private static final Logger LOG = Logger.getLogger(CacheIndex.class);

    private record Slot(MediaKind kind, String name) {}

    private final Path outputRoot;
    private final ConcurrentHashMap<Slot, CacheEntry> entries = new ConcurrentHashMap<>();
    private final AtomicReference<CompletableFuture<Void>> scan = new AtomicReference<>();
    private final AtomicInteger scans = new AtomicInteger();

    public CacheIndex(Path outputRoot) {
        this.outputRoot = outputRoot;
    }

    /**
     * Deterministic output path for a key.
     *
     * @param extension extension including the dot
     */
    public Path outputPath(MediaKind kind, ContentId key, String extension) {
        return outputRoot.resolve(kind.directory()).resolve(key.fileName() + extension);
    }

    /**
     * Returns the entry for a key, dropping it if its file disappeared.
     */
    public Optional<CacheEntry> lookup(MediaKind kind, ContentId key) {
        ensureScanned();
        Slot slot = new Slot(kind, key.fileName());
        CacheEntry entry = entries.get(slot);
        if (entry == null) {
            return Optional.empty();
        }
        if (!Files.isRegularFile(entry.path())) {
            LOG.debugf("Cached %s %s vanished from %s", kind.label(), key, entry.path());
            entries.remove(slot, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    /**
     * Inserts an entry unless one exists; returns the entry now in the index.
     */
    public CacheEntry record(CacheEntry entry) {
        ensureScanned();
        CacheEntry existing = entries.putIfAbsent(slotOf(entry), entry);
        if (existing == null) {
            return entry;
        }
        if (!existing.validated() && entry.validated() && existing.path().equals(entry.path())) {
            entries.replace(slotOf(entry), existing, entry);
            return entry;
        }
        return existing;
    }

    /** Replaces a discovered entry by its validated form. */
    public CacheEntry markValidated(CacheEntry entry, String mimeType, Double durationSeconds) {
        CacheEntry validated = entry.validatedAs(mimeType, durationSeconds);
        entries.replace(slotOf(entry), entry, validated);
        return validated;
    }

    public void invalidate(MediaKind kind, ContentId key) {
        if (entries.remove(new Slot(kind, key.fileName())) != null) {
            LOG.debugf("Invalidated cached %s %s", kind.label(), key);
        }
    }

    public int size() {
        return entries.size();
    }

    /** Number of output scans performed so far. */
    public int scanCount() {
        return scans.get();
    }

    private static Slot slotOf(CacheEntry entry) {
        return new Slot(entry.kind(), entry.key().fileName());
    }

    private void ensureScanned() {
        while (true) {
            CompletableFuture<Void> current = scan.get();
            if (current != null) {
                current.join();
                return;
            }
            CompletableFuture<Void> mine = new CompletableFuture<>();
            if (scan.compareAndSet(null, mine)) {
                try {
                    scanOutputs();
                    mine.complete(null);
                } catch (RuntimeException e) {
                    scan.compareAndSet(mine, null);
                    mine.completeExceptionally(e);
                    throw e;
                }
                return;
            }
        }
    }

    private void scanOutputs() {
        scans.incrementAndGet();
        int found = 0;
        for (MediaKind kind : MediaKind.values()) {
            Path dir = outputRoot.resolve(kind.directory());
            if (!Files.isDirectory(dir)) {
                continue;
            }
            try (Stream<Path> walk = Files.walk(dir)) {
                for (Path path : (Iterable<Path>) walk.filter(Files::isRegularFile)::iterator) {
                    if (OutputFiles.isPart(path)) {
                        continue;
                    }
                    String stem = FileNames.stem(path);
                    if (stem.isBlank()) {
                        continue;
                    }
                    ContentId key = new ContentId(stem);
                    CacheEntry entry = CacheEntry.discovered(key, kind, path);
                    entries.merge(slotOf(entry), entry,
                            (a, b) -> a.path().toString().compareTo(b.path().toString()) <= 0 ? a : b);
                    found++;
                }
            } catch (IOException | UncheckedIOException e) {
                LOG.warnf("Cannot scan output directory %s: %s", dir, e.getMessage());
            }
        }
        LOG.infof("Cache index built: %d outputs under %s", found, outputRoot);
    }
}
