package com.libragraph.chatmedia.core.voice;

import com.libragraph.chatmedia.core.error.ErrorKind;
import com.libragraph.chatmedia.core.error.PipelineException;
import org.jboss.logging.Logger;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Finds the external speech decoder binary.
 *
 * <p>Order: explicitly configured path, configured search directories, the system
 * {@code PATH}, then a binary bundled on the classpath under
 * {@code chatmedia/bin/{platform}/} which is extracted into a writable directory.
 * The result is remembered once found.
 */
public class DecoderLocator {

    private static final Logger LOG = Logger.getLogger(DecoderLocator.class);

    static final String BINARY_NAME = "silk_v3_decoder";

    private final Optional<Path> explicitPath;
    private final List<Path> searchDirs;
    private final Path extractDir;
    private final ClassLoader classLoader;
    private final AtomicReference<Path> located = new AtomicReference<>();

    public DecoderLocator(Optional<Path> explicitPath, List<Path> searchDirs, Path extractDir) {
        this(explicitPath, searchDirs, extractDir, DecoderLocator.class.getClassLoader());
    }

    DecoderLocator(Optional<Path> explicitPath, List<Path> searchDirs, Path extractDir, ClassLoader classLoader) {
        this.explicitPath = explicitPath;
        this.searchDirs = List.copyOf(searchDirs);
        this.extractDir = extractDir;
        this.classLoader = classLoader;
    }

    /**
     * @throws PipelineException with {@link ErrorKind#DECODE_FAILED} if no decoder is available
     */
    public Path locate() {
        Path cached = located.get();
        if (cached != null && Files.isExecutable(cached)) {
            return cached;
        }
        Path found = find();
        located.set(found);
        LOG.infof("Using speech decoder %s", found);
        return found;
    }

    private Path find() {
        if (explicitPath.isPresent()) {
            Path path = explicitPath.get();
            if (Files.isRegularFile(path) && Files.isExecutable(path)) {
                return path;
            }
            throw new PipelineException(ErrorKind.DECODE_FAILED, "Configured decoder is not executable: " + path);
        }

        List<Path> dirs = new ArrayList<>(searchDirs);
        String systemPath = System.getenv("PATH");
        if (systemPath != null) {
            for (String entry : systemPath.split(File.pathSeparator)) {
                if (!entry.isBlank()) {
                    dirs.add(Path.of(entry));
                }
            }
        }
        for (Path dir : dirs) {
            for (String name : binaryNames()) {
                Path candidate = dir.resolve(name);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return candidate;
                }
            }
        }

        return extractBundled().orElseThrow(() -> new PipelineException(ErrorKind.DECODE_FAILED,
                "No " + BINARY_NAME + " found in configured path, search path or classpath"));
    }

    private Optional<Path> extractBundled() {
        for (String name : binaryNames()) {
            String resource = "chatmedia/bin/" + platform() + "/" + name;
            try (InputStream in = classLoader.getResourceAsStream(resource)) {
                if (in == null) {
                    continue;
                }
                Files.createDirectories(extractDir);
                Path target = extractDir.resolve(name);
                Path temp = Files.createTempFile(extractDir, name, ".tmp");
                Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
                if (!temp.toFile().setExecutable(true)) {
                    LOG.debugf("Could not mark %s executable", temp);
                }
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
                LOG.infof("Extracted bundled decoder %s to %s", resource, target);
                return Optional.of(target);
            } catch (IOException e) {
                throw new PipelineException(ErrorKind.DECODE_FAILED,
                        "Cannot extract bundled decoder " + resource + " to " + extractDir, e);
            }
        }
        return Optional.empty();
    }

    static List<String> binaryNames() {
        return isWindows() ? List.of(BINARY_NAME + ".exe") : List.of(BINARY_NAME);
    }

    static String platform() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("mac") || os.contains("darwin")) {
            return "mac";
        }
        return os.contains("win") ? "windows" : "linux";
    }

    private static boolean isWindows() {
        return platform().equals("windows");
    }
}
