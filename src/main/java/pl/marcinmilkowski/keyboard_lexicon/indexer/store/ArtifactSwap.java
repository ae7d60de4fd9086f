package pl.marcinmilkowski.keyboard_lexicon.indexer.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Builds the artifact next to its final location and swaps it in with directory renames,
 * so readers only ever see a complete previous or complete new index.
 */
public final class ArtifactSwap {

    private static final Logger log = LoggerFactory.getLogger(ArtifactSwap.class);

    private ArtifactSwap() {
    }

    /**
     * Creates an empty staging directory beside {@code target}.
     */
    public static Path createStaging(Path target) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path parent = absolute.getParent();
        Files.createDirectories(parent);
        Path staging = parent.resolve(absolute.getFileName() + ".tmp-"
            + ProcessHandle.current().pid() + "-" + System.nanoTime());
        Files.createDirectory(staging);
        return staging;
    }

    /**
     * Replaces {@code target} with {@code staging}. If the final rename fails the
     * previous artifact is moved back.
     */
    public static void publish(Path staging, Path target) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path backup = null;
        if (Files.exists(absolute)) {
            backup = absolute.getParent().resolve(absolute.getFileName() + ".old-" + System.nanoTime());
            move(absolute, backup);
        }
        try {
            move(staging, absolute);
        } catch (IOException e) {
            if (backup != null) {
                move(backup, absolute);
            }
            throw e;
        }
        if (backup != null) {
            try {
                deleteRecursively(backup);
            } catch (IOException e) {
                log.warn("Published {} but could not remove previous artifact {}: {}", absolute, backup, e.getMessage());
            }
        }
        log.info("Published index artifact at {}", absolute);
    }

    /**
     * Removes a staging directory after a failed build.
     */
    public static void discard(Path staging) {
        if (staging == null || !Files.exists(staging)) {
            return;
        }
        try {
            deleteRecursively(staging);
            log.info("Discarded partial artifact {}", staging);
        } catch (IOException e) {
            log.warn("Failed to remove partial artifact {}: {}", staging, e.getMessage());
        }
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to);
        }
    }
}
