package com.autodoc.core.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.autodoc.core.model.AnalysisResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON encoding of {@link AnalysisResult}.
 *
 * <p>Field names are the record component names and enums use their lower snake case labels,
 * so the JSON shape is the model's serialization contract. Decoding an encoded result yields
 * an equal result.
 */
public final class AnalysisResultCodec {

    private static final Logger log = LoggerFactory.getLogger(AnalysisResultCodec.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private AnalysisResultCodec() {
        // Utility class
    }

    public static String toJson(AnalysisResult result) {
        try {
            return JSON_MAPPER.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode analysis result", e);
        }
    }

    /**
     * Decodes a result.
     *
     * @param json encoded result
     * @return decoded result
     * @throws IOException if the text is not a valid encoded result
     */
    public static AnalysisResult fromJson(String json) throws IOException {
        return JSON_MAPPER.readValue(json, AnalysisResult.class);
    }

    public static void write(AnalysisResult result, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        JSON_MAPPER.writeValue(target.toFile(), result);
        log.info("Wrote analysis result to {}", target);
    }

    public static AnalysisResult read(Path source) throws IOException {
        log.debug("Reading analysis result from {}", source);
        return JSON_MAPPER.readValue(source.toFile(), AnalysisResult.class);
    }
}
