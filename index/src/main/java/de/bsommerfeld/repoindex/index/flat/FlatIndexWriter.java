package de.bsommerfeld.repoindex.index.flat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes a flat index document as UTF-8 JSON.
 */
public final class FlatIndexWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FlatIndexWriter() {
    }

    public static void write(JsonNode document, Path target, boolean pretty) throws IOException {
        try (OutputStream out = Files.newOutputStream(target)) {
            writer(pretty).writeValue(out, document);
        }
    }

    public static String toString(JsonNode document, boolean pretty) throws IOException {
        return writer(pretty).writeValueAsString(document);
    }

    private static ObjectWriter writer(boolean pretty) {
        return pretty ? MAPPER.writerWithDefaultPrettyPrinter() : MAPPER.writer();
    }
}
