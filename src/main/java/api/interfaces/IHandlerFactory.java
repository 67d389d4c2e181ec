package api.interfaces;

/** Picks the handler for a request; must not touch the body. */
public interface IHandlerFactory {
    IHttpHandler create(String method, String path);
}
