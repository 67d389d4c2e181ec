package api.interfaces;

/*
AutoCloseable so tests and main can stop the server with try-with-resources
 */
public interface IHttpServer extends AutoCloseable {
    /** Binds and starts accepting in the background. Port 0 picks a free port. */
    void start(int port) throws Exception;

    /** Port actually bound, or -1 before start. */
    int port();

    @Override void close() throws Exception;
}
