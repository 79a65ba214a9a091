package com.tpgsweep.orchestrator.materialize;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes the trainer's JSON config documents.
 *
 * The trainer's templates carry {@code //} and {@code /* *}{@code /} comments,
 * which strict JSON rejects. The reader accepts them; the writer never emits
 * them, so a rewritten document is plain JSON.
 */
@Component
public class ConfigDocuments {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    /** Two-space indent and '\n' line ends on every host. */
    private static final ObjectWriter WRITER = MAPPER.writer(new DefaultPrettyPrinter()
            .withObjectIndenter(new DefaultIndenter("  ", "\n")));

    /**
     * @throws UncheckedIOException     if the file cannot be read
     * @throws IllegalArgumentException if the content is not a JSON object
     */
    public ConfigDocument read(Path file) {
        try {
            return parse(file, Files.readString(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read config " + file, e);
        }
    }

    ConfigDocument parse(Path source, String content) {
        JsonNode node;
        try {
            node = MAPPER.readTree(content);
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed JSON in " + source + ": " + e.getMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Config " + source + " is not a JSON object");
        }
        return new ConfigDocument(source, (ObjectNode) node);
    }

    public void write(ConfigDocument doc, Path file) {
        try {
            Files.writeString(file, render(doc));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write config " + file, e);
        }
    }

    String render(ConfigDocument doc) {
        try {
            return WRITER.writeValueAsString(doc.node()) + "\n";
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot serialise config " + doc.source(), e);
        }
    }

    /** Serialise any value as JSON, e.g. an inference config record. */
    public void writeValue(Object value, Path file) {
        try {
            WRITER.writeValue(file.toFile(), value);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + file, e);
        }
    }

    /** Read a plain JSON document, comments allowed. */
    public JsonNode readTree(Path file) {
        try {
            return MAPPER.readTree(file.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
    }

    /** Bind a JSON document, comments allowed, to {@code type}. */
    public <T> T readValue(Path file, Class<T> type) {
        try {
            return MAPPER.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
    }

    static Object toPlain(JsonNode node) {
        return MAPPER.convertValue(node, Object.class);
    }
}
