package com.formatengine.plugins;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileTypeTests {

    @TempDir
    Path tempDir;

    @Test
    void detectsByExtension() {
        assertEquals(FileType.JSON, FileType.detect(Path.of("config.json")));
        assertEquals(FileType.JSON, FileType.detect(Path.of("CONFIG.JSON")));
        assertEquals(FileType.UNKNOWN, FileType.detect(Path.of("notes.txt")));
    }

    @Test
    void sniffsContentOfFilesWithoutExtension() throws IOException {
        Path json = tempDir.resolve("settings");
        Path text = tempDir.resolve("README");
        Files.writeString(json, "  \n[1, 2]");
        Files.writeString(text, "hello");

        assertEquals(FileType.JSON, FileType.detect(json));
        assertEquals(FileType.UNKNOWN, FileType.detect(text));
    }

    @Test
    void extensionlessFileMustParseToBeJson() throws IOException {
        Path script = tempDir.resolve("setup");
        Path truncated = tempDir.resolve("partial");
        Files.writeString(script, "[ -f config ] && echo found\n");
        Files.writeString(truncated, "{\"a\": [1, 2");

        assertEquals(FileType.UNKNOWN, FileType.detect(script));
        assertEquals(FileType.UNKNOWN, FileType.detect(truncated));
    }
}
