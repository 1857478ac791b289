package ai.mapper.scan;

import java.util.Objects;

/**
 * A Python source file, addressed by its root-relative path ("/" separated).
 */
public record SourceFile(String path, String text) {
    public SourceFile {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(text, "text");
    }
}
