package ai.mapper.io;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Reads and writes integration maps as UTF-8 JSON.
 * - verbose maps are pretty-printed
 * - compact maps are written on a single line
 */
public final class MapWriter {

    private final ObjectMapper prettyMapper;
    private final ObjectMapper compactMapper;

    public MapWriter() {
        this.prettyMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.compactMapper = new ObjectMapper();
    }

    public void writeVerbose(Path file, JsonNode map) throws IOException {
        write(file, map, prettyMapper);
    }

    public void writeCompact(Path file, JsonNode map) throws IOException {
        write(file, map, compactMapper);
    }

    public String toCompactString(JsonNode map) throws IOException {
        return compactMapper.writeValueAsString(map);
    }

    public JsonNode readTree(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new IOException("Map file not found: " + file);
        }
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return compactMapper.readTree(r);
        }
    }

    private static void write(Path file, JsonNode map, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(map, "map");
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        // overwrite each time (deterministic output)
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            mapper.writeValue(w, map);
        }
    }
}
