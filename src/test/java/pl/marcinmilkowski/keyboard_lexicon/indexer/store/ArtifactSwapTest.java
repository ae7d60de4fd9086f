package pl.marcinmilkowski.keyboard_lexicon.indexer.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactSwapTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Staging directory is created beside the target")
    void stagingBesideTarget() throws IOException {
        Path target = tempDir.resolve("words.idx");
        Path staging = ArtifactSwap.createStaging(target);

        assertTrue(Files.isDirectory(staging));
        assertEquals(tempDir.toAbsolutePath(), staging.getParent());
        assertTrue(staging.getFileName().toString().startsWith("words.idx.tmp-"));
    }

    @Test
    @DisplayName("Publishing replaces the previous artifact and leaves no backup")
    void publishReplaces() throws IOException {
        Path target = tempDir.resolve("words.idx");
        Files.createDirectories(target);
        Files.writeString(target.resolve("marker"), "old");

        Path staging = ArtifactSwap.createStaging(target);
        Files.writeString(staging.resolve("marker"), "new");
        ArtifactSwap.publish(staging, target);

        assertEquals("new", Files.readString(target.resolve("marker")));
        assertFalse(Files.exists(staging));
        assertEquals(List.of("words.idx"), siblings());
    }

    @Test
    @DisplayName("Publishing works when no previous artifact exists")
    void publishFresh() throws IOException {
        Path target = tempDir.resolve("nested/words.idx");
        Path staging = ArtifactSwap.createStaging(target);
        Files.writeString(staging.resolve("marker"), "new");

        ArtifactSwap.publish(staging, target);

        assertEquals("new", Files.readString(target.resolve("marker")));
    }

    @Test
    @DisplayName("A failed final move restores the previous artifact")
    void publishFailureRestoresBackup() throws IOException {
        Path target = tempDir.resolve("words.idx");
        Files.createDirectories(target);
        Files.writeString(target.resolve("marker"), "old");
        Path vanished = tempDir.resolve("words.idx.tmp-gone");

        assertThrows(IOException.class, () -> ArtifactSwap.publish(vanished, target));

        assertEquals("old", Files.readString(target.resolve("marker")));
        assertEquals(List.of("words.idx"), siblings());
    }

    @Test
    @DisplayName("Staging cannot be created when the target's parent is a file")
    void stagingUnderFile() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "x");

        assertThrows(IOException.class, () -> ArtifactSwap.createStaging(blocker.resolve("words.idx")));
        assertEquals(List.of("blocker"), siblings());
    }

    @Test
    @DisplayName("Discarding removes the staging tree and tolerates null")
    void discard() throws IOException {
        Path staging = ArtifactSwap.createStaging(tempDir.resolve("words.idx"));
        Files.createDirectories(staging.resolve("words"));
        Files.writeString(staging.resolve("words/segments_1"), "x");

        ArtifactSwap.discard(staging);
        ArtifactSwap.discard(null);

        assertFalse(Files.exists(staging));
        assertTrue(siblings().isEmpty());
    }

    private List<String> siblings() throws IOException {
        try (Stream<Path> entries = Files.list(tempDir)) {
            return entries.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }
}
