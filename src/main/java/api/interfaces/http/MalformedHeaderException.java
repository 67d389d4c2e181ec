package api.interfaces.http;

/** A header line without the {@code ": "} separator. */
public class MalformedHeaderException extends RequestParseException {
    private final String line;

    public MalformedHeaderException(String line) {
        super("malformed header line: " + line);
        this.line = line;
    }

    public String line() { return line; }
}
