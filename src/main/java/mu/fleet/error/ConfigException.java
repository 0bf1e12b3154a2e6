package mu.fleet.error;

/**
 * Malformed roster or policy file, or a missing/invalid startup setting.
 * Fatal at startup.
 */
public class ConfigException extends MuException {

    private final int line;
    private final String text;

    public ConfigException(String message) {
        super(message);
        this.line = 0;
        this.text = null;
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
        this.line = 0;
        this.text = null;
    }

    public ConfigException(int line, String text, String problem) {
        super(problem + " on line " + line + ": \"" + text + "\"");
        this.line = line;
        this.text = text;
    }

    /** 1-based line number, or 0 when the problem is not tied to a line. */
    public int line() {
        return line;
    }

    /** Offending line text, if any. */
    public String text() {
        return text;
    }
}
