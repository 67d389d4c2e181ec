package app;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @TempDir Path tmp;

    @Test
    void defaultsWhenNothingGiven() {
        ServerConfig c = ServerConfig.fromArgs(new String[0], new Properties());
        assertEquals("127.0.0.1", c.host());
        assertEquals(4221, c.port());
        assertEquals(Optional.empty(), c.directory());
    }

    @Test
    void directoryFlag() {
        ServerConfig c = ServerConfig.fromArgs(new String[]{"--directory", "/tmp/files"}, new Properties());
        assertEquals(Optional.of(Paths.get("/tmp/files")), c.directory());
    }

    @Test
    void layersApplyInOrder() throws IOException {
        Path json = tmp.resolve("server.json");
        Files.writeString(json, "{\"host\":\"0.0.0.0\",\"port\":8080,\"directory\":\"/from/file\"}");

        ServerConfig fileOnly = ServerConfig.fromArgs(new String[]{"--config", json.toString()}, new Properties());
        assertEquals("0.0.0.0", fileOnly.host());
        assertEquals(8080, fileOnly.port());
        assertEquals(Optional.of(Paths.get("/from/file")), fileOnly.directory());

        Properties props = new Properties();
        props.setProperty("server.port", "9090");
        ServerConfig withProps = ServerConfig.fromArgs(new String[]{"--config", json.toString()}, props);
        assertEquals(9090, withProps.port());
        assertEquals("0.0.0.0", withProps.host());

        ServerConfig withFlags = ServerConfig.fromArgs(
                new String[]{"--config", json.toString(), "--port", "7070", "--directory", "/flag"}, props);
        assertEquals(7070, withFlags.port());
        assertEquals(Optional.of(Paths.get("/flag")), withFlags.directory());
    }

    @Test
    void partialConfigFileKeepsDefaults() throws IOException {
        Path json = tmp.resolve("partial.json");
        Files.writeString(json, "{\"directory\":\"/data\"}");
        ServerConfig c = ServerConfig.fromArgs(new String[]{"--config", json.toString()}, new Properties());
        assertEquals(4221, c.port());
        assertEquals("127.0.0.1", c.host());
    }

    @Test
    void badInputsAreRejected() throws IOException {
        Properties none = new Properties();
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.fromArgs(new String[]{"--directory"}, none));
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.fromArgs(new String[]{"--verbose"}, none));
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.fromArgs(new String[]{"--port", "http"}, none));
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.fromArgs(new String[]{"--port", "70000"}, none));
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.fromArgs(new String[]{"--config", tmp.resolve("missing.json").toString()}, none));

        Path broken = tmp.resolve("broken.json");
        Files.writeString(broken, "{\"port\": [1,2]}");
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.fromArgs(new String[]{"--config", broken.toString()}, none));
    }
}
