package work.lcod.config.node;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Element of a configuration tree: a scalar, a sequence or a mapping, plus the directives that steer
 * merging ({@link Priority}, {@link MergeMode}, relocation) and evaluation ({@link Tag}).
 *
 * <p>Nodes are mutable; the merge engine and the evaluator always work on {@link #deepCopy() copies}
 * so that source trees can be reused across builds.</p>
 */
public final class Node {
    public enum Kind {
        SCALAR,
        SEQUENCE,
        MAPPING
    }

    private final Kind kind;
    private final Object scalar;
    private final List<Node> items;
    private final Map<String, Node> entries;

    private Tag tag = Tag.PLAIN;
    private Priority priority = Priority.DEFAULT;
    private MergeMode mergeMode;
    private PathReference relocation;
    private Map<String, Object> metadata = Map.of();
    private Origin origin;
    private List<Node> mergeStages = List.of();

    private Node(Kind kind, Object scalar, List<Node> items, Map<String, Node> entries) {
        this.kind = kind;
        this.scalar = scalar;
        this.items = items;
        this.entries = entries;
    }

    public static Node scalar(Object value) {
        return new Node(Kind.SCALAR, normalizeScalar(value), null, null);
    }

    public static Node sequence(List<Node> items) {
        var copy = new ArrayList<Node>(items.size());
        for (Node item : items) {
            copy.add(Objects.requireNonNull(item, "sequence item"));
        }
        return new Node(Kind.SEQUENCE, null, copy, null);
    }

    public static Node mapping(Map<String, Node> entries) {
        var copy = new LinkedHashMap<String, Node>();
        entries.forEach((key, value) -> copy.put(
            Objects.requireNonNull(key, "mapping key"),
            Objects.requireNonNull(value, "mapping value")
        ));
        return new Node(Kind.MAPPING, null, null, copy);
    }

    public static Node emptyMapping() {
        return new Node(Kind.MAPPING, null, null, new LinkedHashMap<>());
    }

    public static Node emptySequence() {
        return new Node(Kind.SEQUENCE, null, new ArrayList<>(), null);
    }

    /**
     * Builds a node from plain Java values: maps become mappings, lists become sequences and anything else a scalar.
     * Existing nodes are returned as they are.
     */
    public static Node from(Object value) {
        if (value instanceof Node node) {
            return node;
        }
        if (value instanceof Map<?, ?> map) {
            var node = emptyMapping();
            map.forEach((key, child) -> node.put(String.valueOf(key), from(child)));
            return node;
        }
        if (value instanceof List<?> list) {
            var node = emptySequence();
            list.forEach(child -> node.add(from(child)));
            return node;
        }
        return scalar(value);
    }

    public static Node of(Tag tag, Object value) {
        Node node = from(value);
        node.tag = Objects.requireNonNull(tag, "tag");
        return node;
    }

    public static Node required() {
        return of(Tag.required(), null);
    }

    public static Node ref(String target) {
        return of(Tag.ref(), target);
    }

    public static Node deleteMarker() {
        return scalar(null).mergeMode(MergeMode.DELETE);
    }

    private static Object normalizeScalar(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        if (value instanceof BigInteger big && big.bitLength() < 64) {
            return big.longValue();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.doubleValue();
        }
        if (value instanceof Character c) {
            return String.valueOf(c);
        }
        return value;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isScalar() {
        return kind == Kind.SCALAR;
    }

    public boolean isSequence() {
        return kind == Kind.SEQUENCE;
    }

    public boolean isMapping() {
        return kind == Kind.MAPPING;
    }

    public Object scalarValue() {
        return scalar;
    }

    public List<Node> items() {
        requireKind(Kind.SEQUENCE);
        return Collections.unmodifiableList(items);
    }

    public Map<String, Node> entries() {
        requireKind(Kind.MAPPING);
        return Collections.unmodifiableMap(entries);
    }

    public int size() {
        return switch (kind) {
            case SCALAR -> 0;
            case SEQUENCE -> items.size();
            case MAPPING -> entries.size();
        };
    }

    public Node get(String key) {
        requireKind(Kind.MAPPING);
        return entries.get(key);
    }

    public Node get(int index) {
        requireKind(Kind.SEQUENCE);
        return index >= 0 && index < items.size() ? items.get(index) : null;
    }

    public boolean containsKey(String key) {
        return kind == Kind.MAPPING && entries.containsKey(key);
    }

    public Node put(String key, Node value) {
        requireKind(Kind.MAPPING);
        entries.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
        mergeStages = List.of();
        return this;
    }

    public Node remove(String key) {
        requireKind(Kind.MAPPING);
        mergeStages = List.of();
        return entries.remove(key);
    }

    public Node add(Node value) {
        requireKind(Kind.SEQUENCE);
        items.add(Objects.requireNonNull(value, "value"));
        mergeStages = List.of();
        return this;
    }

    public Node set(int index, Node value) {
        requireKind(Kind.SEQUENCE);
        items.set(index, Objects.requireNonNull(value, "value"));
        mergeStages = List.of();
        return this;
    }

    public Node removeAt(int index) {
        requireKind(Kind.SEQUENCE);
        mergeStages = List.of();
        return items.remove(index);
    }

    /**
     * Child at the given segment ({@link String} key or {@link Integer} index), or null when there is none.
     */
    public Node child(Object segment) {
        if (segment instanceof Integer index) {
            return kind == Kind.SEQUENCE ? get(index) : null;
        }
        return kind == Kind.MAPPING ? entries.get((String) segment) : null;
    }

    /**
     * Replaces the child at {@code segment}. Returns false when this node has no such slot.
     */
    public boolean replaceChild(Object segment, Node value) {
        if (segment instanceof Integer index) {
            if (kind != Kind.SEQUENCE || index < 0 || index >= items.size()) {
                return false;
            }
            items.set(index, value);
            mergeStages = List.of();
            return true;
        }
        if (kind != Kind.MAPPING || !entries.containsKey((String) segment)) {
            return false;
        }
        entries.put((String) segment, value);
        mergeStages = List.of();
        return true;
    }

    /**
     * Physical lookup; no references are followed and delete markers are returned as they are.
     */
    public Node find(NodePath path) {
        Node current = this;
        for (Object segment : path.segments()) {
            current = current.child(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    public Tag tag() {
        return tag;
    }

    public Node tag(Tag newTag) {
        this.tag = Objects.requireNonNull(newTag, "tag");
        mergeStages = List.of();
        return this;
    }

    public Priority priority() {
        return priority;
    }

    public Node priority(Priority newPriority) {
        this.priority = Objects.requireNonNull(newPriority, "priority");
        mergeStages = List.of();
        return this;
    }

    /**
     * Explicit merge mode, or null when the node uses the default of its kind.
     */
    public MergeMode mergeMode() {
        return mergeMode;
    }

    public Node mergeMode(MergeMode newMode) {
        this.mergeMode = newMode;
        mergeStages = List.of();
        return this;
    }

    public MergeMode effectiveMergeMode() {
        return mergeMode != null ? mergeMode : MergeMode.defaultFor(kind);
    }

    public boolean isDeleteMarker() {
        return mergeMode == MergeMode.DELETE;
    }

    /**
     * Where this node moves once the merge pass that produced it completes, or null.
     */
    public PathReference relocation() {
        return relocation;
    }

    public Node relocation(PathReference target) {
        this.relocation = target;
        mergeStages = List.of();
        return this;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public Node metadata(Map<String, Object> newMetadata) {
        this.metadata = newMetadata == null || newMetadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(newMetadata));
        mergeStages = List.of();
        return this;
    }

    public Origin origin() {
        return origin;
    }

    public Node origin(Origin newOrigin) {
        this.origin = newOrigin;
        mergeStages = List.of();
        return this;
    }

    /**
     * Copies tag, priority, merge mode, relocation, metadata and origin from {@code other}.
     */
    public Node copyAttributesFrom(Node other) {
        this.tag = other.tag;
        this.priority = other.priority;
        this.mergeMode = other.mergeMode;
        this.relocation = other.relocation;
        this.metadata = other.metadata;
        this.origin = other.origin;
        this.mergeStages = List.of();
        return this;
    }

    /**
     * Trees this node was merged from, oldest first, or an empty list when it is not an untouched merge result.
     * Any change made to this node's children or attributes afterwards forgets them; changes made deeper
     * in the tree are not tracked.
     */
    public List<Node> mergeStages() {
        return mergeStages;
    }

    public Node mergeStages(List<Node> stages) {
        this.mergeStages = List.copyOf(stages);
        return this;
    }

    public Node deepCopy() {
        Node copy = switch (kind) {
            case SCALAR -> new Node(Kind.SCALAR, scalar, null, null);
            case SEQUENCE -> {
                var list = new ArrayList<Node>(items.size());
                for (Node item : items) {
                    list.add(item.deepCopy());
                }
                yield new Node(Kind.SEQUENCE, null, list, null);
            }
            case MAPPING -> {
                var map = new LinkedHashMap<String, Node>();
                entries.forEach((key, value) -> map.put(key, value.deepCopy()));
                yield new Node(Kind.MAPPING, null, null, map);
            }
        };
        copy.copyAttributesFrom(this);
        copy.mergeStages = mergeStages;
        return copy;
    }

    /**
     * Plain Java view of the value ({@link LinkedHashMap}, {@link ArrayList} or scalar). Tags are ignored and
     * delete markers are left out.
     */
    public Object toPlain() {
        return switch (kind) {
            case SCALAR -> scalar;
            case SEQUENCE -> {
                var list = new ArrayList<Object>(items.size());
                for (Node item : items) {
                    if (!item.isDeleteMarker()) {
                        list.add(item.toPlain());
                    }
                }
                yield list;
            }
            case MAPPING -> {
                var map = new LinkedHashMap<String, Object>();
                entries.forEach((key, value) -> {
                    if (!value.isDeleteMarker()) {
                        map.put(key, value.toPlain());
                    }
                });
                yield map;
            }
        };
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Expected a " + expected.name().toLowerCase() + " node but found " + kind.name().toLowerCase());
        }
    }

    /**
     * Structural equality: value, tag, priority, merge mode and relocation. Metadata and origin are ignored.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Node other)) {
            return false;
        }
        return kind == other.kind
            && tag.equals(other.tag)
            && priority == other.priority
            && effectiveMergeMode() == other.effectiveMergeMode()
            && Objects.equals(relocation, other.relocation)
            && Objects.equals(scalar, other.scalar)
            && Objects.equals(items, other.items)
            && Objects.equals(entries, other.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, tag, priority, effectiveMergeMode(), relocation, scalar, items, entries);
    }

    @Override
    public String toString() {
        var builder = new StringBuilder();
        if (!tag.isPlain()) {
            builder.append(tag).append(' ');
        }
        if (priority != Priority.DEFAULT) {
            builder.append('(').append(priority.name().toLowerCase()).append(") ");
        }
        if (mergeMode != null) {
            builder.append('<').append(mergeMode.name().toLowerCase()).append("> ");
        }
        builder.append(switch (kind) {
            case SCALAR -> String.valueOf(scalar);
            case SEQUENCE -> items.toString();
            case MAPPING -> entries.toString();
        });
        return builder.toString();
    }
}
