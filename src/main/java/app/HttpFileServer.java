package app;

import api.impl.SocketHttpServer;
import api.impl.handlers.HandlerFactory;
import api.interfaces.IHandlerFactory;
import infrastructure.impl.DirectoryFileStore;
import infrastructure.interfaces.IFileStore;

public class HttpFileServer {

    public static void main(String[] args) throws Exception {
        ServerConfig config;
        try {
            config = ServerConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("[Server] " + e.getMessage());
            System.err.println(ServerConfig.USAGE);
            System.exit(2);
            return;
        }

        IFileStore files = config.directory()
                .map(DirectoryFileStore::new)
                .orElseGet(DirectoryFileStore::unconfigured);
        IHandlerFactory factory = new HandlerFactory(files);

        SocketHttpServer server = new SocketHttpServer(config.host(), factory);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try { server.close(); }
            catch (Exception e) { System.err.println("[Server] shutdown error: " + e.getMessage()); }
        }, "shutdown"));

        server.start(config.port());
        System.out.println("[Server] files directory: "
                + config.directory().map(Object::toString).orElse("(none)"));
        server.join();
    }
}
