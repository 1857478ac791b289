package ai.mapper.model;

/**
 * A file that could not be analysed. Recorded and reported, never fatal to the run.
 */
public record FileError(
        String path,   // root-relative
        int line,      // 0 when the failure is not tied to a line
        String message
) {
}
