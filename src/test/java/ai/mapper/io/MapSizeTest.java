package ai.mapper.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class MapSizeTest {

    @TempDir
    Path dir;

    @Test
    void estimatesFourBytesPerToken() {
        assertEquals(1, MapSize.ofBytes(0).estimatedTokens());
        assertEquals(1, MapSize.ofBytes(7).estimatedTokens());
        assertEquals(2_500, MapSize.ofBytes(10_000).estimatedTokens());
        assertEquals(2.0, MapSize.ofBytes(2048).kilobytes());
        assertEquals(1.0, MapSize.ofBytes(1024 * 1024).megabytes());
    }

    @Test
    void measuresAWrittenMap() throws IOException {
        final Path file = dir.resolve("map.json");
        Files.writeString(file, "{\"v\":\"2.0\",\"idx\":{\"1\":\"é\"}}", StandardCharsets.UTF_8);

        final MapSize size = MapSize.of(file);
        assertEquals(28, size.bytes());
        assertEquals(7, size.estimatedTokens());
        assertEquals("28 bytes (0.0 KB), ~7 tokens", size.describe());
    }

    @Test
    void describesLargeMapsWithGrouping() {
        assertEquals("12,345 bytes (12.1 KB), ~3,086 tokens", MapSize.ofBytes(12_345).describe());
    }

    @Test
    void missingFileIsAnIoError() {
        assertThrows(IOException.class, () -> MapSize.of(dir.resolve("absent.json")));
        assertThrows(IllegalArgumentException.class, () -> MapSize.ofBytes(-1));
    }
}
