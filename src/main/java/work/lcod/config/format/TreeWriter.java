package work.lcod.config.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import work.lcod.config.node.Node;

/**
 * Writes concrete trees back out. Tags and merge directives are not written.
 */
public final class TreeWriter {
    private static final ObjectWriter YAML_WRITER = new ObjectMapper(
        YAMLFactory.builder()
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .build()
    ).writer();
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    private TreeWriter() {}

    public static String write(Node tree, Format format) {
        try {
            return switch (format) {
                case YAML -> YAML_WRITER.writeValueAsString(tree.toPlain());
                case JSON -> JSON_WRITER.writeValueAsString(tree.toPlain()) + System.lineSeparator();
            };
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize configuration: " + ex.getOriginalMessage(), ex);
        }
    }

    public static void write(Node tree, Format format, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, write(tree, format));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write " + target, ex);
        }
    }

    public enum Format {
        YAML,
        JSON;

        public static Format from(String value) {
            if (value == null || value.isBlank()) {
                return YAML;
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "yaml", "yml" -> YAML;
                case "json" -> JSON;
                default -> throw new IllegalArgumentException("Unsupported output format: " + value);
            };
        }
    }
}
