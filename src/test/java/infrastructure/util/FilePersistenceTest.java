package infrastructure.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FilePersistenceTest {

    @TempDir Path tmp;

    static final class Settings {
        String name;
        Integer size;
    }

    @Test
    void loadsKnownKeys() throws IOException {
        Path f = tmp.resolve("s.json");
        Files.writeString(f, "{\"name\":\"a\",\"size\":3,\"ignored\":true}");
        Settings s = FilePersistence.load(f, Settings.class);
        assertEquals("a", s.name);
        assertEquals(3, s.size);
    }

    @Test
    void emptyFileGivesEmptyObject() throws IOException {
        Path f = tmp.resolve("empty.json");
        Files.writeString(f, "");
        Settings s = FilePersistence.load(f, Settings.class);
        assertNotNull(s);
        assertNull(s.name);
    }

    @Test
    void invalidJsonIsIoError() throws IOException {
        Path f = tmp.resolve("bad.json");
        Files.writeString(f, "{not json");
        assertThrows(IOException.class, () -> FilePersistence.load(f, Settings.class));
        assertThrows(IOException.class, () -> FilePersistence.load(tmp.resolve("none.json"), Settings.class));
    }
}
