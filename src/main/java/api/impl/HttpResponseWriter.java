package api.impl;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/**
 * Serializes a {@link HttpResponseImpl} onto the wire.
 * <p>
 * Headers go out sorted by name. {@code Content-Length} is filled in from the
 * body when the handler did not set it, since the body is only framed by that
 * header.
 */
public final class HttpResponseWriter {

    public static final String VERSION = "HTTP/1.1";
    private static final String CRLF = "\r\n";

    private HttpResponseWriter() {}

    public static void write(OutputStream out, HttpResponseImpl res) throws IOException {
        out.write(toBytes(res));
        out.flush();
    }

    /** Serializes without changing {@code res}. */
    public static byte[] toBytes(HttpResponseImpl res) {
        Map<String, String> headers = new TreeMap<>(res.headers());
        headers.putIfAbsent("Content-Length", String.valueOf(res.body().length));

        StringBuilder head = new StringBuilder(128);
        head.append(VERSION).append(' ')
            .append(res.status()).append(' ')
            .append(res.reason()).append(CRLF);
        for (Map.Entry<String, String> e : headers.entrySet()) {
            head.append(e.getKey()).append(": ").append(e.getValue()).append(CRLF);
        }
        head.append(CRLF);

        byte[] headBytes = head.toString().getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream buf = new ByteArrayOutputStream(headBytes.length + res.body().length);
        buf.write(headBytes, 0, headBytes.length);
        buf.write(res.body(), 0, res.body().length);
        return buf.toByteArray();
    }
}
