package com.symmetryvaults.core.level;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.symmetryvaults.core.model.LevelDocument;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes level documents as pretty-printed JSON.
 *
 * <p>Unknown properties are ignored on read; null values are omitted on write
 * except where the model asks for an explicit {@code null}.
 */
public final class LevelCodec {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private LevelCodec() {
    }

    /**
     * Reads a level document from a file.
     *
     * @param file JSON file
     * @return the document
     * @throws IOException if the file cannot be read or is not a level document
     */
    public static LevelDocument read(Path file) throws IOException {
        return parse(Files.readString(file));
    }

    /**
     * Parses a level document.
     *
     * @param json JSON text
     * @return the document
     * @throws IOException if the text is not a level document
     */
    public static LevelDocument parse(String json) throws IOException {
        LevelDocument document = JSON_MAPPER.readValue(json, LevelDocument.class);
        if (document == null) {
            throw new IOException("Document is empty");
        }
        return document;
    }

    /**
     * Serializes a level document.
     *
     * @param document the document
     * @return pretty-printed JSON ending with a newline
     */
    public static String write(LevelDocument document) {
        try {
            return JSON_MAPPER.writeValueAsString(document) + "\n";
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize level " + document.levelId(), e);
        }
    }
}
