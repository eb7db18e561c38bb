package com.libragraph.chatmedia.core.cache;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * File helpers for publishing outputs: write to {@code *.part}, validate, then move into place.
 */
public final class OutputFiles {

    private static final Logger LOG = Logger.getLogger(OutputFiles.class);

    public static final String PART_SUFFIX = ".part";

    private OutputFiles() {
    }

    public static Path partFor(Path target) {
        return target.resolveSibling(target.getFileName() + PART_SUFFIX);
    }

    /** Part file for one of several attempts at the same target, e.g. {@code abc.png.thumbnail.part}. */
    public static Path partFor(Path target, String attempt) {
        return target.resolveSibling(target.getFileName() + "." + attempt + PART_SUFFIX);
    }

    public static boolean isPart(Path path) {
        return path.getFileName().toString().endsWith(PART_SUFFIX);
    }

    /**
     * Moves {@code part} over {@code target}, atomically where the file system allows it.
     */
    public static void publish(Path part, Path target) throws IOException {
        try {
            Files.move(part, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debugf("Atomic move unsupported for %s, falling back to replace", target);
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /** Deletes a file, logging instead of throwing. */
    public static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.debugf("Could not delete %s: %s", path, e.getMessage());
        }
    }

    /** Deletes a directory tree, logging instead of throwing. */
    public static void deleteTreeQuietly(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                        throws IOException {
                    Files.delete(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path d, IOException exc)
                        throws IOException {
                    Files.delete(d);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            LOG.debugf("Could not delete temp directory %s: %s", dir, e.getMessage());
        }
    }
}
