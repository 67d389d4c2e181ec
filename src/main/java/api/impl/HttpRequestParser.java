package api.impl;

import api.interfaces.http.HttpRequest;
import api.interfaces.http.MalformedHeaderException;
import api.interfaces.http.MalformedRequestLineException;
import api.interfaces.http.TruncatedBodyException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads exactly one HTTP/1.1 request from a stream.
 * <p>
 * Lines may end in CRLF or a bare LF. The path is kept as received: no
 * percent-decoding and no dot-segment removal. Header names are
 * case-sensitive and the last occurrence of a name wins.
 * <p>
 * The body is read only when {@code Content-Length} parses as a non-negative
 * integer, otherwise its length is taken as 0. No chunked decoding.
 */
public final class HttpRequestParser {

    public static final String HEADER_SEPARATOR = ": ";
    private static final Pattern DIGITS = Pattern.compile("\\+?\\d+");

    private HttpRequestParser() {}

    /**
     * @param in stream positioned at the start of a request; it is not closed
     * @return the parsed request
     * @throws MalformedRequestLineException fewer than three tokens on the first line
     * @throws MalformedHeaderException      a header line without {@code ": "}
     * @throws TruncatedBodyException        stream ended inside the declared body
     * @throws IOException                   transport failure
     */
    public static HttpRequest parse(InputStream in) throws IOException {
        String start = readRequestLine(in);
        String[] tokens = start.trim().split("\\s+");
        if (tokens.length < 3) {
            throw new MalformedRequestLineException("malformed request line: " + start);
        }
        // tokens past the third are ignored
        String method = tokens[0];
        String path = tokens[1];
        String version = tokens[2];

        Map<String, String> headers = readHeaders(in);

        long length = contentLength(headers.get("Content-Length"));
        // never allocate the declared size up front, read what actually arrives
        byte[] body = in.readNBytes((int) Math.min(length, Integer.MAX_VALUE));
        if (body.length < length) {
            throw new TruncatedBodyException(length, body.length);
        }
        return new MinimalHttpRequest(method, path, version, headers, body);
    }

    /** Skips blank lines the transport may put ahead of the request line. */
    private static String readRequestLine(InputStream in) throws IOException {
        String line;
        while ((line = readLine(in)) != null) {
            if (!line.isBlank()) return line;
        }
        throw new MalformedRequestLineException("connection closed before request line");
    }

    private static Map<String, String> readHeaders(InputStream in) throws IOException {
        Map<String, String> headers = new HashMap<>();
        String line;
        // end of stream also ends the header block
        while ((line = readLine(in)) != null && !line.isEmpty()) {
            int idx = line.indexOf(HEADER_SEPARATOR);
            if (idx < 0) {
                throw new MalformedHeaderException(line);
            }
            String name = line.substring(0, idx).trim();
            String value = line.substring(idx + HEADER_SEPARATOR.length()).trim();
            // blank names or values are dropped, not rejected
            if (!name.isEmpty() && !value.isEmpty()) {
                headers.put(name, value);
            }
        }
        return headers;
    }

    /**
     * Declared body length. Missing, negative or non-numeric values are 0;
     * a digit string too large for a long is still a declared length.
     */
    static long contentLength(String raw) {
        if (raw == null) return 0;
        String v = raw.trim();
        try {
            return Math.max(0, Long.parseLong(v));
        } catch (NumberFormatException e) {
            return DIGITS.matcher(v).matches() ? Long.MAX_VALUE : 0;
        }
    }

    /**
     * Reads up to LF and drops one trailing CR.
     *
     * @return the line, or null if the stream ended before any byte was read
     */
    static String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                return stripCr(buf.toByteArray());
            }
            buf.write(b);
        }
        return buf.size() == 0 ? null : stripCr(buf.toByteArray());
    }

    private static String stripCr(byte[] bytes) {
        int len = bytes.length;
        if (len > 0 && bytes[len - 1] == '\r') len--;
        return new String(bytes, 0, len, StandardCharsets.UTF_8);
    }
}
