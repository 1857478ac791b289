package ai.mapper.io;

/**
 * The compact payload was written with an abbreviation table this build does not know.
 */
public class UnsupportedFormatVersionException extends DecodeException {

    private final String version;

    public UnsupportedFormatVersionException(String version) {
        super("unsupported compact format version: " + version + " (expected " + AbbreviationTable.VERSION + ")");
        this.version = version;
    }

    public String version() {
        return version;
    }
}
