package api.impl;

import api.interfaces.http.HttpRequest;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public class MinimalHttpRequest implements HttpRequest {
    private static final byte[] EMPTY = new byte[0];

    private final String method;
    private final String path;
    private final String version;
    private final Map<String,String> headers;
    private final byte[] body;

    public MinimalHttpRequest(String method, String path, String version,
                              Map<String,String> headers, byte[] body){
        this.method = method;
        this.path = path;
        this.version = version;
        this.headers = headers == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new HashMap<>(headers));
        this.body = body == null ? EMPTY : body.clone();
    }

    @Override public String method(){ return method; }
    @Override public String path(){ return path; }
    @Override public String version(){ return version; }

    @Override
    public String header(String name){
        if (name == null) return null;
        return headers.get(name);
    }

    @Override public Map<String, String> headers() { return headers; }

    @Override public byte[] body() { return body.clone(); }

    @Override
    public String toString() {
        return method + " " + path + " " + version;
    }
}
