package infrastructure.impl;

import infrastructure.interfaces.IFileStore;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

/**
 * Files under a single directory fixed at startup.
 * <p>
 * Names are resolved as-is: there is no canonicalization and {@code ..}
 * segments are not rejected, so a name can reach outside the directory.
 * Writes are create-or-truncate with no locking; concurrent writers to one
 * name race and the last one wins.
 */
public final class DirectoryFileStore implements IFileStore {

    private final Path dir; // null when no directory was configured

    public DirectoryFileStore(Path dir) {
        this.dir = dir;
    }

    public static DirectoryFileStore unconfigured() {
        return new DirectoryFileStore(null);
    }

    public Path directory() { return dir; }

    @Override
    public byte[] read(String name) throws IOException {
        return Files.readAllBytes(resolve(name));
    }

    @Override
    public void write(String name, byte[] data) throws IOException {
        Path target = resolve(name);
        try (OutputStream os = Files.newOutputStream(target,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            os.write(data);
        }
    }

    private Path resolve(String name) throws IOException {
        if (dir == null) {
            throw new IOException("no file directory configured");
        }
        try {
            return dir.resolve(Paths.get(name));
        } catch (InvalidPathException e) {
            throw new IOException("invalid file name: " + name, e);
        }
    }
}
