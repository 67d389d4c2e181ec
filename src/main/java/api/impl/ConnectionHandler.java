package api.impl;

import api.interfaces.IHandlerFactory;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.RequestParseException;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;

/**
 * One request/response exchange on one accepted socket, then close.
 * <p>
 * A request that does not parse gets no response: the failure is logged and
 * the socket closed. A handler that throws is answered with a 500. Nothing
 * escapes {@link #run()}, so one bad connection cannot disturb the others.
 */
public final class ConnectionHandler implements Runnable {

    private final Socket client;
    private final IHandlerFactory factory;

    public ConnectionHandler(Socket client, IHandlerFactory factory) {
        this.client = client;
        this.factory = factory;
    }

    @Override
    public void run() {
        try (Socket s = client;
             InputStream in = new BufferedInputStream(s.getInputStream());
             OutputStream out = s.getOutputStream()) {
            exchange(in, out, factory);
        } catch (RequestParseException e) {
            System.err.println("[Server] bad request from " + client.getRemoteSocketAddress() + ": " + e.getMessage());
        } catch (IOException e) {
            System.err.println("[Server] connection error: " + e.getMessage());
        } catch (RuntimeException e) {
            System.err.println("[Server] error: " + e);
        }
    }

    /**
     * Parse, route, handle, write. Exposed for stream-level tests.
     *
     * @throws RequestParseException if the request does not parse; nothing is written
     * @throws IOException on transport failure
     */
    public static void exchange(InputStream in, OutputStream out, IHandlerFactory factory) throws IOException {
        HttpRequest req = HttpRequestParser.parse(in);
        HttpResponseImpl res = new HttpResponseImpl();

        IHttpHandler handler = factory.create(req.method(), req.path());
        try {
            handler.handle(req, res);
        } catch (Exception e) {
            System.err.println("[Server] handler failed for " + req + ": " + e);
            res = new HttpResponseImpl();
            res.status(HttpStatus.INTERNAL_SERVER_ERROR);
        }

        HttpResponseWriter.write(out, res);
    }
}
