package api.impl;

import api.interfaces.IHandlerFactory;
import api.interfaces.IHttpServer;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Blocking accept loop that hands every connection to its own task.
 * <p>
 * The loop runs on a single thread and only ever waits on {@code accept()}.
 * Connection tasks run on an unbounded cached pool; there is no connection
 * limit and no read or write timeout.
 */
public final class SocketHttpServer implements IHttpServer {

    static final long ACCEPT_BACKOFF_MS = 100;

    private final String host;
    private final IHandlerFactory factory;
    private final AtomicInteger connections = new AtomicInteger();
    private final ExecutorService workers = Executors.newCachedThreadPool(namedThreads());

    private volatile ServerSocket server;
    private volatile boolean closed;
    private Thread acceptor;
    private int acceptFailures; // acceptor thread only

    public SocketHttpServer(String host, IHandlerFactory factory) {
        this.host = host;
        this.factory = factory;
    }

    @Override
    public synchronized void start(int port) throws IOException {
        if (server != null) {
            throw new IllegalStateException("already started");
        }
        ServerSocket ss = new ServerSocket();
        ss.setReuseAddress(true);
        ss.bind(new InetSocketAddress(InetAddress.getByName(host), port));
        server = ss;
        acceptor = new Thread(this::acceptLoop, "http-acceptor");
        acceptor.start();
        System.out.println("[Server] listening on " + host + ":" + ss.getLocalPort());
    }

    @Override
    public int port() {
        ServerSocket ss = server;
        return ss == null ? -1 : ss.getLocalPort();
    }

    private void acceptLoop() {
        ServerSocket ss = server;
        while (!closed) {
            Socket client;
            try {
                client = ss.accept();
            } catch (IOException e) {
                if (closed) return;
                acceptFailed(e);
                continue;
            }
            acceptFailures = 0;
            if (!dispatch(client)) return;
        }
    }

    /**
     * Hands an accepted socket to a worker.
     *
     * @return false if the pool is shut down; the socket is closed in that case
     */
    boolean dispatch(Socket client) {
        connections.incrementAndGet();
        try {
            workers.execute(new ConnectionHandler(client, factory));
            return true;
        } catch (RejectedExecutionException e) {
            try {
                client.close();
            } catch (IOException closeError) {
                System.err.println("[Server] close failed: " + closeError.getMessage());
            }
            return false;
        }
    }

    /**
     * Pauses before the next accept so a lasting failure (out of file
     * descriptors) does not spin. Only the first failure of a run is logged.
     *
     * @return true if this failure was logged
     */
    boolean acceptFailed(IOException e) {
        boolean first = acceptFailures++ == 0;
        if (first) {
            System.err.println("[Server] accept failed: " + e.getMessage());
        }
        try {
            Thread.sleep(ACCEPT_BACKOFF_MS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        return first;
    }

    /** Connections accepted since start. */
    public int acceptedConnections() {
        return connections.get();
    }

    /** Blocks the caller until the accept loop ends. */
    public void join() throws InterruptedException {
        Thread t = acceptor;
        if (t != null) t.join();
    }

    @Override
    public void close() throws IOException, InterruptedException {
        closed = true;
        ServerSocket ss = server;
        if (ss != null) ss.close();
        workers.shutdown();
        if (!workers.awaitTermination(2, TimeUnit.SECONDS)) {
            workers.shutdownNow();
        }
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "http-conn-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
