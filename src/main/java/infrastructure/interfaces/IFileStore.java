package infrastructure.interfaces;

import java.io.IOException;

/** Flat named-file storage behind the {@code /files/} routes. */
public interface IFileStore {
    byte[] read(String name) throws IOException;
    void write(String name, byte[] data) throws IOException;
}
