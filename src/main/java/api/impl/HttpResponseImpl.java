package api.impl;

import api.interfaces.http.HttpResponse;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

public class HttpResponseImpl implements HttpResponse {
    private int status = HttpStatus.OK;
    // sorted so the wire order is stable
    private final Map<String, String> headers = new TreeMap<>();
    private byte[] body = new byte[0];

    @Override
    public void status(int code) {
        this.status = code;
    }

    @Override
    public void header(String name, String value) {
        headers.put(name, value);
    }

    @Override
    public void body(String text) {
        this.body = text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public void body(byte[] bytes) {
        this.body = bytes == null ? new byte[0] : bytes;
    }

    // getters used by writer
    public int status() { return status; }
    public String reason() { return HttpStatus.reason(status); }
    public Map<String, String> headers() { return headers; }
    public byte[] body() { return body; }
}
