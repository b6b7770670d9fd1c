package work.lcod.config.format;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLParser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.lcod.config.error.ConfigBuildException;
import work.lcod.config.error.ParseException;
import work.lcod.config.node.Node;
import work.lcod.config.node.NodePath;
import work.lcod.config.node.Origin;

/**
 * Reads tagged YAML into {@link Node} trees, one tree per document of the stream.
 * Tags are looked up in a {@link TagRegistry}; YAML core tags ({@code !!str} and friends) are left to Jackson.
 */
public final class YamlTreeReader {
    private static final String CORE_TAG_PREFIX = "tag:yaml.org,2002:";

    private final YAMLFactory factory = new YAMLFactory();
    private final TagRegistry tags;

    public YamlTreeReader() {
        this(TagRegistry.standard());
    }

    public YamlTreeReader(TagRegistry tags) {
        this.tags = Objects.requireNonNull(tags, "tags");
    }

    public List<Node> read(Path file) {
        String text;
        try {
            text = Files.readString(file);
        } catch (IOException ex) {
            throw new ParseException("Failed to read " + file + ": " + ex.getMessage(), null, Origin.of(file.toString(), null), ex);
        }
        return read(text, file.toString());
    }

    public List<Node> read(String text, String sourceName) {
        var documents = new ArrayList<Node>();
        try (YAMLParser parser = factory.createParser(text)) {
            JsonToken token;
            while ((token = parser.nextToken()) != null) {
                Node document = readValue(parser, token, NodePath.ROOT, sourceName);
                if (document.isScalar() && document.scalarValue() == null && document.tag().isPlain()
                    && document.mergeMode() == null) {
                    continue;
                }
                documents.add(document);
            }
        } catch (IOException ex) {
            throw new ParseException(describe(ex, sourceName), null, Origin.of(sourceName, null), ex);
        }
        return documents;
    }

    private Node readValue(YAMLParser parser, JsonToken token, NodePath path, String sourceName) throws IOException {
        String typeId = parser.getTypeId();
        Origin origin = Origin.of(sourceName, path);
        Node raw = switch (token) {
            case START_OBJECT -> readMapping(parser, path, sourceName);
            case START_ARRAY -> readSequence(parser, path, sourceName);
            case VALUE_STRING -> Node.scalar(parser.getText());
            case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> Node.scalar(parser.getNumberValue());
            case VALUE_TRUE -> Node.scalar(Boolean.TRUE);
            case VALUE_FALSE -> Node.scalar(Boolean.FALSE);
            case VALUE_NULL -> Node.scalar(null);
            case VALUE_EMBEDDED_OBJECT -> Node.scalar(parser.getEmbeddedObject());
            default -> throw new ParseException("Unexpected YAML token " + token, path, origin);
        };
        raw.origin(origin);
        if (typeId == null || typeId.isEmpty() || typeId.startsWith(CORE_TAG_PREFIX)) {
            return raw;
        }
        try {
            return tags.apply(typeId, raw, path, origin);
        } catch (ConfigBuildException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ParseException("Invalid !" + typeId + " node: " + ex.getMessage(), path, origin, ex);
        }
    }

    private Node readMapping(YAMLParser parser, NodePath path, String sourceName) throws IOException {
        Node mapping = Node.emptyMapping();
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
            if (token != JsonToken.FIELD_NAME) {
                throw new ParseException("Expected a mapping key but found " + token, path, Origin.of(sourceName, path));
            }
            String key = parser.currentName();
            NodePath childPath = path.child(key);
            mapping.put(key, readValue(parser, parser.nextToken(), childPath, sourceName));
        }
        return mapping;
    }

    private Node readSequence(YAMLParser parser, NodePath path, String sourceName) throws IOException {
        Node sequence = Node.emptySequence();
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            sequence.add(readValue(parser, token, path.child(sequence.size()), sourceName));
        }
        return sequence;
    }

    private static String describe(IOException ex, String sourceName) {
        String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        if (ex instanceof JsonProcessingException processing) {
            JsonLocation location = processing.getLocation();
            message = processing.getOriginalMessage();
            if (location != null) {
                return "Malformed YAML in " + sourceName + " at line " + location.getLineNr()
                    + ", column " + location.getColumnNr() + ": " + message;
            }
        }
        return "Malformed YAML in " + sourceName + ": " + message;
    }
}
