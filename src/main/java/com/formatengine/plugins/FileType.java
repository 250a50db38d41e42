package com.formatengine.plugins;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.formatengine.util.LoggerUtil;

/**
 * File types with a formatter plugin, detected by extension and, for files without one,
 * by content.
 */
public enum FileType {
    JSON("json"),
    UNKNOWN("");

    private static final Logger logger = LoggerUtil.getLogger(FileType.class);
    private static final Map<Path, FileType> typeCache = new ConcurrentHashMap<>();
    private static final int MAX_CACHE_SIZE = 10000;
    private static final int CONTENT_SNIFF_BYTES = 512;
    private static final JsonFactory jsonFactory = new JsonFactory();

    private final String extension;

    FileType(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Detects the file type of a path. Results are cached per path.
     */
    public static FileType detect(Path filePath) {
        FileType cachedType = typeCache.get(filePath);
        if (cachedType != null) {
            return cachedType;
        }

        if (typeCache.size() > MAX_CACHE_SIZE) {
            typeCache.clear();
            logger.fine("Cleared file type detection cache");
        }

        FileType detected = _detectByExtension(filePath);
        if (detected == UNKNOWN && _hasNoExtension(filePath)) {
            detected = _detectByContent(filePath);
        }
        typeCache.put(filePath, detected);
        return detected;
    }

    private static FileType _detectByExtension(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return UNKNOWN;
        }

        String extension = fileName.substring(dot + 1);
        for (FileType type : values()) {
            if (!type.extension.isEmpty() && type.extension.equals(extension)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    private static boolean _hasNoExtension(Path filePath) {
        return filePath.getFileName().toString().indexOf('.') < 0;
    }

    /**
     * A file whose first non-whitespace character opens an object or array, and which parses
     * as a JSON document, is taken to be JSON.
     */
    private static FileType _detectByContent(Path filePath) {
        if (!Files.isRegularFile(filePath)) {
            return UNKNOWN;
        }
        try (InputStream in = Files.newInputStream(filePath)) {
            String head = new String(in.readNBytes(CONTENT_SNIFF_BYTES), StandardCharsets.UTF_8).stripLeading();
            if ((head.startsWith("{") || head.startsWith("[")) && _parsesAsJson(filePath)) {
                return JSON;
            }
            return UNKNOWN;
        } catch (IOException e) {
            logger.log(Level.FINE, "Error reading file for type detection: " + filePath, e);
            return UNKNOWN;
        }
    }

    private static boolean _parsesAsJson(Path filePath) throws IOException {
        try (JsonParser parser = jsonFactory.createParser(filePath.toFile())) {
            JsonToken token = parser.nextToken();
            while (token != null) {
                token = parser.nextToken();
            }
            return true;
        } catch (JsonProcessingException e) {
            logger.fine("Not detected as JSON: " + filePath + " - " + e.getOriginalMessage());
            return false;
        }
    }

    /**
     * Clear the file type detection cache.
     */
    public static void clearCache() {
        typeCache.clear();
    }

    public String getDescription() {
        return switch (this) {
            case JSON -> "JSON document";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
