package api.impl.handlers;

import api.impl.HttpStatus;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

import java.nio.charset.StandardCharsets;

public class UserAgentHandler implements IHttpHandler {
    static final String UNKNOWN = "Unknown";

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        String agent = req.header("User-Agent");
        byte[] body = (agent == null ? UNKNOWN : agent).getBytes(StandardCharsets.UTF_8);
        res.status(HttpStatus.OK);
        res.header("Content-Type", "text/plain");
        res.header("Content-Length", String.valueOf(body.length));
        res.body(body);
    }
}
