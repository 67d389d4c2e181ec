package api.interfaces.http;

import java.util.Map;

/** Parsed request contract, immutable once built */
public interface HttpRequest {
    String method();
    String path();
    String version();

    // header names are case-sensitive as received
    String header(String name);
    Map<String, String> headers();
    byte[] body();
}
