package infrastructure.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** JSON file reading for startup settings. */
public final class FilePersistence {
    private static final Gson gson = new GsonBuilder().create();
    private FilePersistence() {}

    /**
     * Reads {@code file} as JSON into {@code cls}.
     *
     * @return the bound object, never null; an empty file yields a default instance
     * @throws IOException if the file cannot be read or is not valid JSON for {@code cls}
     */
    public static <T> T load(Path file, Class<T> cls) throws IOException {
        String s = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        try {
            T value = gson.fromJson(s, cls);
            return value != null ? value : gson.fromJson("{}", cls);
        } catch (JsonParseException e) {
            throw new IOException("invalid JSON in " + file + ": " + e.getMessage(), e);
        }
    }
}
