package api.interfaces.http;

/** Stream ended before {@code Content-Length} bytes of body arrived. */
public class TruncatedBodyException extends RequestParseException {
    private final long expected;
    private final int received;

    public TruncatedBodyException(long expected, int received) {
        super("body truncated: expected " + expected + " bytes, got " + received);
        this.expected = expected;
        this.received = received;
    }

    public long expected() { return expected; }
    public int received() { return received; }
}
