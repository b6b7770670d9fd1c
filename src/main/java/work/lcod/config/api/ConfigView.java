package work.lcod.config.api;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import work.lcod.config.node.Node;
import work.lcod.config.node.NodePath;
import work.lcod.config.node.Origin;
import work.lcod.config.node.Priority;
import work.lcod.config.node.Tag;

/**
 * Read-only access to a built tree.
 *
 * <p>Values are reached only through {@link #get(String)}, {@link #get(int)} and {@link #at(String)}.
 * Information about the node itself lives behind {@link #node()}, so a key named {@code path} or
 * {@code tag} never shadows anything.</p>
 */
public final class ConfigView {
    private final Node node;
    private final NodePath path;

    private ConfigView(Node node, NodePath path) {
        this.node = node;
        this.path = path;
    }

    public static ConfigView of(Node tree) {
        return new ConfigView(Objects.requireNonNull(tree, "tree"), NodePath.ROOT);
    }

    public ConfigView get(String key) {
        Node child = node.isMapping() ? node.get(key) : null;
        if (child == null || child.isDeleteMarker()) {
            throw new NoSuchElementException("No key '" + key + "' at '" + path + "'");
        }
        return new ConfigView(child, path.child(key));
    }

    public ConfigView get(int index) {
        if (!node.isSequence() || index < 0 || index >= node.size()) {
            throw new NoSuchElementException("No index " + index + " at '" + path + "'");
        }
        return new ConfigView(node.get(index), path.child(index));
    }

    /**
     * Descends along a path written like {@code model.layers[0].size}, relative to this view.
     */
    public ConfigView at(String relativePath) {
        ConfigView current = this;
        for (Object segment : NodePath.parse(relativePath).segments()) {
            current = segment instanceof Integer index ? current.get(index) : current.get((String) segment);
        }
        return current;
    }

    public boolean has(String key) {
        return node.isMapping() && node.containsKey(key) && !node.get(key).isDeleteMarker();
    }

    public Set<String> keys() {
        if (!node.isMapping()) {
            return Set.of();
        }
        return ((Map<?, ?>) node.toPlain()).keySet().stream().map(String::valueOf)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public int size() {
        return node.isScalar() ? 0 : keysOrItems();
    }

    private int keysOrItems() {
        Object plain = node.toPlain();
        return plain instanceof Map<?, ?> map ? map.size() : ((List<?>) plain).size();
    }

    public Object value() {
        return node.toPlain();
    }

    public String asString() {
        if (node.isScalar() && node.scalarValue() != null) {
            return String.valueOf(node.scalarValue());
        }
        throw notA("a string");
    }

    public long asLong() {
        if (node.isScalar() && node.scalarValue() instanceof Number number) {
            return number.longValue();
        }
        throw notA("an integer");
    }

    public double asDouble() {
        if (node.isScalar() && node.scalarValue() instanceof Number number) {
            return number.doubleValue();
        }
        throw notA("a number");
    }

    public boolean asBoolean() {
        if (node.isScalar() && node.scalarValue() instanceof Boolean flag) {
            return flag;
        }
        throw notA("a boolean");
    }

    public List<Object> asList() {
        if (node.isSequence()) {
            @SuppressWarnings("unchecked")
            List<Object> list = (List<Object>) node.toPlain();
            return list;
        }
        throw notA("a sequence");
    }

    public Map<String, Object> asMap() {
        if (node.isMapping()) {
            @SuppressWarnings("unchecked")
            Map<String, Object> map = (Map<String, Object>) node.toPlain();
            return map;
        }
        throw notA("a mapping");
    }

    public NodeInfo node() {
        return new NodeInfo(path, node.tag(), node.priority(), node.metadata(), node.origin());
    }

    private IllegalStateException notA(String expected) {
        return new IllegalStateException("Value at '" + path + "' is not " + expected + ": " + node.toPlain());
    }

    @Override
    public String toString() {
        return String.valueOf(node.toPlain());
    }

    public record NodeInfo(NodePath path, Tag tag, Priority priority, Map<String, Object> metadata, Origin origin) {}
}
