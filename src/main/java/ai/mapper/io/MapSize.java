package ai.mapper.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Size of a written map and a rough token estimate (about four bytes of JSON per token).
 */
public record MapSize(long bytes, long estimatedTokens) {

    static final int BYTES_PER_TOKEN = 4;

    public static MapSize of(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new IOException("Map file not found: " + file);
        }
        return ofBytes(Files.size(file));
    }

    public static MapSize ofBytes(long bytes) {
        if (bytes < 0) {
            throw new IllegalArgumentException("bytes must be >= 0: " + bytes);
        }
        return new MapSize(bytes, Math.max(1, bytes / BYTES_PER_TOKEN));
    }

    public double kilobytes() {
        return bytes / 1024.0;
    }

    public double megabytes() {
        return bytes / (1024.0 * 1024.0);
    }

    /** e.g. "12,345 bytes (12.1 KB), ~3,086 tokens". */
    public String describe() {
        return String.format(Locale.ROOT, "%,d bytes (%.1f KB), ~%,d tokens", bytes, kilobytes(), estimatedTokens);
    }
}
