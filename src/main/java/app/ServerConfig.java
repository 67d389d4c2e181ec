package app;

import infrastructure.util.FilePersistence;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.Properties;

/**
 * Startup settings, read once and shared read-only by every connection.
 * <p>
 * Layers, later wins: defaults, a JSON file given by {@code --config},
 * {@code server.*} system properties, then command-line flags.
 */
public final class ServerConfig {

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 4221;
    public static final String USAGE =
            "usage: http-file-server [--directory <dir>] [--port <n>] [--host <addr>] [--config <file.json>]";

    private final String host;
    private final int port;
    private final Path directory;

    public ServerConfig(String host, int port, Path directory) {
        this.host = host;
        this.port = port;
        this.directory = directory;
    }

    public static ServerConfig defaults() {
        return new ServerConfig(DEFAULT_HOST, DEFAULT_PORT, null);
    }

    public String host() { return host; }
    public int port() { return port; }
    public Optional<Path> directory() { return Optional.ofNullable(directory); }

    public static ServerConfig fromArgs(String[] args) {
        return fromArgs(args, System.getProperties());
    }

    /** @throws IllegalArgumentException on a bad flag, port or config file */
    public static ServerConfig fromArgs(String[] args, Properties props) {
        String host = DEFAULT_HOST;
        String port = String.valueOf(DEFAULT_PORT);
        String dir = null;

        String configFile = flagValue(args, "--config");
        if (configFile != null) {
            FileSettings file;
            try {
                file = FilePersistence.load(Paths.get(configFile), FileSettings.class);
            } catch (IOException e) {
                throw new IllegalArgumentException("cannot read config " + configFile + ": " + e.getMessage(), e);
            }
            if (file.host != null) host = file.host;
            if (file.port != null) port = String.valueOf(file.port);
            if (file.directory != null) dir = file.directory;
        }

        host = props.getProperty("server.host", host);
        port = props.getProperty("server.port", port);
        dir = props.getProperty("server.directory", dir);

        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            switch (flag) {
                case "--directory", "--port", "--host", "--config" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("missing value for " + flag);
                    }
                    String value = args[++i];
                    if (flag.equals("--directory")) dir = value;
                    else if (flag.equals("--port")) port = value;
                    else if (flag.equals("--host")) host = value;
                }
                default -> throw new IllegalArgumentException("unknown argument: " + flag);
            }
        }

        return new ServerConfig(host, parsePort(port), dir == null ? null : Paths.get(dir));
    }

    private static String flagValue(String[] args, String flag) {
        for (int i = 0; i < args.length - 1; i++) {
            if (flag.equals(args[i])) return args[i + 1];
        }
        return null;
    }

    private static int parsePort(String raw) {
        int p;
        try {
            p = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("port is not a number: " + raw);
        }
        if (p < 0 || p > 65535) {
            throw new IllegalArgumentException("port out of range: " + p);
        }
        return p;
    }

    @Override
    public String toString() {
        return "ServerConfig{host=" + host + ", port=" + port + ", directory=" + directory + "}";
    }

    /** Shape of the optional JSON config file; every key may be left out. */
    static final class FileSettings {
        String host;
        Integer port;
        String directory;
    }
}
