package work.lcod.config.format;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseError;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.config.error.ParseException;
import work.lcod.config.node.Node;
import work.lcod.config.node.NodePath;
import work.lcod.config.node.Origin;

/**
 * Reads TOML documents. TOML has no tags, so every node comes out plain with default priority;
 * dates and times are kept as their ISO text.
 */
public final class TomlTreeReader {
    public List<Node> read(Path file) {
        try {
            return read(Files.readString(file), file.toString());
        } catch (IOException ex) {
            throw new ParseException("Failed to read " + file + ": " + ex.getMessage(), null, Origin.of(file.toString(), null), ex);
        }
    }

    public List<Node> read(String text, String sourceName) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            TomlParseError first = result.errors().get(0);
            throw new ParseException(
                "Malformed TOML in " + sourceName + " at line " + first.position().line()
                    + ", column " + first.position().column() + ": " + first.getMessage(),
                null,
                Origin.of(sourceName, null)
            );
        }
        return List.of(convertTable(result, NodePath.ROOT, sourceName));
    }

    private static Node convertTable(TomlTable table, NodePath path, String sourceName) {
        Node mapping = Node.emptyMapping().origin(Origin.of(sourceName, path));
        for (Map.Entry<String, Object> entry : table.toMap().entrySet()) {
            NodePath childPath = path.child(entry.getKey());
            mapping.put(entry.getKey(), convertValue(entry.getValue(), childPath, sourceName));
        }
        return mapping;
    }

    private static Node convertValue(Object value, NodePath path, String sourceName) {
        if (value instanceof TomlTable table) {
            return convertTable(table, path, sourceName);
        }
        if (value instanceof TomlArray array) {
            var items = new ArrayList<Node>(array.size());
            for (int i = 0; i < array.size(); i++) {
                items.add(convertValue(array.get(i), path.child(i), sourceName));
            }
            return Node.sequence(items).origin(Origin.of(sourceName, path));
        }
        if (value instanceof Map<?, ?> map) {
            Node mapping = Node.emptyMapping().origin(Origin.of(sourceName, path));
            map.forEach((key, child) -> mapping.put(String.valueOf(key), convertValue(child, path.child(String.valueOf(key)), sourceName)));
            return mapping;
        }
        if (value instanceof List<?> list) {
            var items = new ArrayList<Node>(list.size());
            for (int i = 0; i < list.size(); i++) {
                items.add(convertValue(list.get(i), path.child(i), sourceName));
            }
            return Node.sequence(items).origin(Origin.of(sourceName, path));
        }
        Object scalar = value instanceof TemporalAccessor ? value.toString() : value;
        return Node.scalar(scalar).origin(Origin.of(sourceName, path));
    }
}
