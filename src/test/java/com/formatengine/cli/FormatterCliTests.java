package com.formatengine.cli;

import com.formatengine.config.ConfigurationLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FormatterCliTests {

    private static final String FORMATTED = "{\n    \"name\": \"engine\",\n    \"tags\": [1, 2]\n}\n";
    private static final String UNFORMATTED = "{\n\"name\":\"engine\",\n\"tags\":[1,2]}";

    @TempDir
    Path tempDir;

    private Path configFile;

    @BeforeEach
    void writeConfig() throws IOException {
        configFile = tempDir.resolve("config.yml");
        Files.writeString(configFile, "general:\n  lineWidth: 80\n  ignoreFiles:\n    - \"**/skip/**\"\n");
    }

    private int run(String... args) {
        String[] withOptions = new String[args.length + 2];
        System.arraycopy(args, 0, withOptions, 0, args.length);
        withOptions[args.length] = "--no-color";
        withOptions[args.length + 1] = "--config=" + configFile;
        return FormatterCli.run(withOptions);
    }

    private Path sources() throws IOException {
        return Files.createDirectories(tempDir.resolve("src"));
    }

    @Test
    void checkPassesForFormattedFiles() throws IOException {
        Files.writeString(sources().resolve("a.json"), FORMATTED);

        assertEquals(0, run("check", sources().toString()));
    }

    @Test
    void checkFailsWithoutWriting() throws IOException {
        Path file = sources().resolve("a.json");
        Files.writeString(file, UNFORMATTED);

        assertEquals(1, run("check", sources().toString()));
        assertEquals(UNFORMATTED, Files.readString(file));
    }

    @Test
    void formatRewritesChangedFiles() throws IOException {
        Path file = sources().resolve("a.json");
        Files.writeString(file, UNFORMATTED);

        assertEquals(0, run("format", sources().toString(), "--threads=2"));
        assertEquals(FORMATTED, Files.readString(file));
        assertEquals(0, run("check", file.toString()));
    }

    @Test
    void formatReportsUnparsableFiles() throws IOException {
        Path file = sources().resolve("broken.json");
        Files.writeString(file, "{\"a\": ");

        assertEquals(1, run("format", sources().toString()));
        assertEquals("{\"a\": ", Files.readString(file));
    }

    @Test
    void ignoredFilesAreSkipped() throws IOException {
        Path skipped = Files.createDirectories(sources().resolve("skip")).resolve("a.json");
        Files.writeString(skipped, UNFORMATTED);

        assertEquals(0, run("check", sources().toString()));
    }

    @Test
    void extensionlessScriptsAreNotChecked() throws IOException {
        Files.writeString(sources().resolve("a.json"), FORMATTED);
        Files.writeString(sources().resolve("build"), "#!/bin/sh\n[ -d out ] || mkdir out\n");
        Files.writeString(sources().resolve("check"), "[ -f a.json ] && echo ok\n");

        assertEquals(0, run("check", sources().toString()));
    }

    @Test
    void includePatternLimitsFiles() throws IOException {
        Files.writeString(sources().resolve("a.json"), FORMATTED);
        Files.writeString(sources().resolve("other.json"), UNFORMATTED);

        assertEquals(0, run("check", sources().toString(), "--include=a.*"));
        assertEquals(1, run("check", sources().toString()));
    }

    @Test
    void initWritesLoadableConfiguration() {
        Path target = tempDir.resolve("generated/.formatengine.yml");

        assertEquals(0, FormatterCli.run(new String[]{"init", "--no-color", "--config=" + target}));
        assertTrue(Files.exists(target));
        assertFalse(ConfigurationLoader.loadConfigWithDiagnostics(target).hasDiagnostics());

        assertEquals(1, FormatterCli.run(new String[]{"init", "--no-color", "--config=" + target}));
        assertEquals(0, FormatterCli.run(new String[]{"init", "--force", "--no-color", "--config=" + target}));
    }

    @Test
    void rejectsBadInvocations() {
        assertEquals(1, FormatterCli.run(new String[0]));
        assertEquals(1, run("frobnicate"));
        assertEquals(1, run("check"));
        assertEquals(1, run("check", tempDir.resolve("missing").toString()));
    }

    @Test
    void printsVersionAndHelp() {
        assertEquals(0, FormatterCli.run(new String[]{"--version"}));
        assertEquals(0, FormatterCli.run(new String[]{"-h", "--no-color"}));
    }
}
