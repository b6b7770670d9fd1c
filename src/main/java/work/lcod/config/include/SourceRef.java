package work.lcod.config.include;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;
import work.lcod.config.error.ParseException;

/**
 * Identifies one source of tree content: a file or a piece of in-memory text.
 * File references are normalised to absolute paths so that they can key per-build caches.
 */
public record SourceRef(Kind kind, Path path, String text, String name) {
    public SourceRef {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        if (kind == Kind.FILE) {
            Objects.requireNonNull(path, "path");
        } else {
            Objects.requireNonNull(text, "text");
        }
    }

    public static SourceRef file(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        return new SourceRef(Kind.FILE, normalized, null, normalized.toString());
    }

    public static SourceRef inline(String text) {
        return inline(text, "<inline>");
    }

    public static SourceRef inline(String text, String name) {
        return new SourceRef(Kind.INLINE, null, text, name);
    }

    /**
     * Reads the stream fully; the stream is not closed.
     */
    public static SourceRef stream(InputStream in, String name) {
        try {
            return inline(new String(in.readAllBytes(), StandardCharsets.UTF_8), name);
        } catch (IOException ex) {
            throw new ParseException("Failed to read source stream " + name + ": " + ex.getMessage(), null, null, ex);
        }
    }

    public boolean isFile() {
        return kind == Kind.FILE;
    }

    /**
     * Directory used to resolve includes relative to this source, if it has one.
     */
    public Path directory() {
        return isFile() ? path.getParent() : null;
    }

    @Override
    public String toString() {
        return name;
    }

    public enum Kind {
        FILE,
        INLINE
    }
}
