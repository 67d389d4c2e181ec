package api.impl.handlers;

import api.impl.HttpStatus;
import api.impl.Route;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import infrastructure.interfaces.IFileStore;

import java.io.IOException;

/**
 * Stores the request body as {@code <directory>/<name>}, replacing any existing file.
 * Concurrent posts to the same name are not coordinated; the last write wins.
 */
public class FilePostHandler implements IHttpHandler {
    private final IFileStore files;

    public FilePostHandler(IFileStore files) { this.files = files; }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        String name = req.path().substring(Route.FILES_PREFIX.length());
        try {
            files.write(name, req.body());
            res.status(HttpStatus.CREATED);
        } catch (IOException e) {
            System.err.println("[Files] write failed for " + name + ": " + e.getMessage());
            res.status(HttpStatus.INTERNAL_SERVER_ERROR);
        }
    }
}
