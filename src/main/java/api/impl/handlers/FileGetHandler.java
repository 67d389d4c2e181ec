package api.impl.handlers;

import api.impl.HttpStatus;
import api.impl.Route;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import infrastructure.interfaces.IFileStore;

import java.io.IOException;

/**
 * Serves {@code <directory>/<name>} for {@code GET /files/<name>}.
 * Any read failure (missing, unreadable, a directory) is a 404.
 */
public class FileGetHandler implements IHttpHandler {
    private final IFileStore files;

    public FileGetHandler(IFileStore files) { this.files = files; }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        String name = req.path().substring(Route.FILES_PREFIX.length());
        byte[] content;
        try {
            content = files.read(name);
        } catch (IOException e) {
            res.status(HttpStatus.NOT_FOUND);
            return;
        }
        res.status(HttpStatus.OK);
        res.header("Content-Type", "application/octet-stream");
        res.header("Content-Length", String.valueOf(content.length));
        res.body(content);
    }
}
