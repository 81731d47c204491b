package com.acme.export.file;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AtomicFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void testWriteCreatesParentsAndReplacesContent() throws Exception {
        Path target = tempDir.resolve("a").resolve("b").resolve("1.json");

        AtomicFiles.write(target, "old".getBytes(StandardCharsets.UTF_8));
        AtomicFiles.write(target, "new".getBytes(StandardCharsets.UTF_8));

        assertEquals("new", Files.readString(target));
        try (Stream<Path> files = Files.list(target.getParent())) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("1.json");
        }
    }

    @Test
    void testDirectorySync() {
        assertDoesNotThrow(() -> AtomicFiles.syncDirectory(tempDir));
    }

    @Test
    void testDirectorySyncToleratesUnopenableDirectory() {
        assertDoesNotThrow(() -> AtomicFiles.syncDirectory(tempDir.resolve("missing")));
    }
}
