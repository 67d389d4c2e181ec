package api.impl.handlers;

import api.impl.HttpStatus;
import api.impl.Route;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

import java.nio.charset.StandardCharsets;

/** Replies with whatever follows {@code /echo/} in the path. */
public class EchoHandler implements IHttpHandler {
    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        byte[] text = req.path().substring(Route.ECHO_PREFIX.length()).getBytes(StandardCharsets.UTF_8);
        res.status(HttpStatus.OK);
        res.header("Content-Type", "text/plain");
        res.header("Content-Length", String.valueOf(text.length));
        res.body(text);
    }
}
