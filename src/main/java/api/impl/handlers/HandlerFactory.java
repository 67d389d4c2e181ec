package api.impl.handlers;

import api.impl.Route;
import api.interfaces.IHandlerFactory;
import api.interfaces.IHttpHandler;
import infrastructure.interfaces.IFileStore;

/**
 * Maps a request to its handler through {@link Route}.
 * Handlers hold no per-request state, so one instance of each is shared.
 */
public class HandlerFactory implements IHandlerFactory {

    private final IHttpHandler echo = new EchoHandler();
    private final IHttpHandler userAgent = new UserAgentHandler();
    private final IHttpHandler fileGet;
    private final IHttpHandler filePost;
    private final IHttpHandler success = new SuccessHandler();
    private final IHttpHandler notFound = new NotFoundHandler();

    public HandlerFactory(IFileStore files) {
        this.fileGet = new FileGetHandler(files);
        this.filePost = new FilePostHandler(files);
    }

    @Override
    public IHttpHandler create(String method, String path) {
        return switch (Route.match(method, path)) {
            case ECHO -> echo;
            case USER_AGENT -> userAgent;
            case FILE_GET -> fileGet;
            case FILE_POST -> filePost;
            case ROOT -> success;
            case NOT_FOUND -> notFound;
        };
    }
}
