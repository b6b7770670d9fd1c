package work.lcod.config.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable location inside a tree: a list of mapping keys ({@link String}) and sequence indices ({@link Integer}).
 * Text form is {@code a.b[0].c}; keys that would not survive that syntax are written as {@code ['a.b']}.
 */
public final class NodePath {
    public static final NodePath ROOT = new NodePath(List.of());

    private final List<Object> segments;

    private NodePath(List<Object> segments) {
        this.segments = segments;
    }

    public static NodePath of(Object... segments) {
        var list = new ArrayList<Object>(segments.length);
        for (Object segment : segments) {
            list.add(checkSegment(segment));
        }
        return new NodePath(Collections.unmodifiableList(list));
    }

    public static NodePath parse(String text) {
        Objects.requireNonNull(text, "text");
        var list = new ArrayList<Object>();
        int i = 0;
        int length = text.length();
        boolean expectKey = true;
        while (i < length) {
            char c = text.charAt(i);
            if (c == '[') {
                if (i + 1 < length && (text.charAt(i + 1) == '\'' || text.charAt(i + 1) == '"')) {
                    char quote = text.charAt(i + 1);
                    int endQuote = text.indexOf(quote, i + 2);
                    if (endQuote < 0 || endQuote + 1 >= length || text.charAt(endQuote + 1) != ']') {
                        throw new IllegalArgumentException("Unterminated quoted key in path: " + text);
                    }
                    list.add(text.substring(i + 2, endQuote));
                    i = endQuote + 2;
                } else {
                    int close = text.indexOf(']', i);
                    if (close < 0) {
                        throw new IllegalArgumentException("Unclosed '[' in path: " + text);
                    }
                    list.add(parseIndex(text.substring(i + 1, close).trim(), text));
                    i = close + 1;
                }
                expectKey = false;
            } else if (c == '.') {
                if (expectKey) {
                    throw new IllegalArgumentException("Empty key in path: " + text);
                }
                i++;
                expectKey = true;
                if (i == length) {
                    throw new IllegalArgumentException("Path ends with '.': " + text);
                }
            } else {
                if (!expectKey) {
                    throw new IllegalArgumentException("Missing '.' before key in path: " + text);
                }
                int end = i;
                while (end < length && text.charAt(end) != '.' && text.charAt(end) != '[') {
                    end++;
                }
                list.add(text.substring(i, end));
                i = end;
                expectKey = false;
            }
        }
        return new NodePath(Collections.unmodifiableList(list));
    }

    private static int parseIndex(String inner, String text) {
        try {
            int index = Integer.parseInt(inner);
            if (index < 0) {
                throw new IllegalArgumentException("Negative index in path: " + text);
            }
            return index;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid index '" + inner + "' in path: " + text, ex);
        }
    }

    private static Object checkSegment(Object segment) {
        if (segment instanceof String || segment instanceof Integer) {
            return segment;
        }
        throw new IllegalArgumentException("Path segments must be String or Integer, got: " + segment);
    }

    public List<Object> segments() {
        return segments;
    }

    public int size() {
        return segments.size();
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public Object segment(int index) {
        return segments.get(index);
    }

    public Object last() {
        if (segments.isEmpty()) {
            throw new IllegalStateException("Root path has no last segment");
        }
        return segments.get(segments.size() - 1);
    }

    public NodePath child(String key) {
        return append(Objects.requireNonNull(key, "key"));
    }

    public NodePath child(int index) {
        return append(index);
    }

    public NodePath append(NodePath other) {
        if (other.isRoot()) {
            return this;
        }
        var list = new ArrayList<Object>(segments);
        list.addAll(other.segments);
        return new NodePath(Collections.unmodifiableList(list));
    }

    private NodePath append(Object segment) {
        var list = new ArrayList<Object>(segments.size() + 1);
        list.addAll(segments);
        list.add(segment);
        return new NodePath(Collections.unmodifiableList(list));
    }

    /**
     * Parent path; the root is its own parent.
     */
    public NodePath parent() {
        if (segments.size() <= 1) {
            return ROOT;
        }
        return new NodePath(segments.subList(0, segments.size() - 1));
    }

    public boolean startsWith(NodePath prefix) {
        return prefix.segments.size() <= segments.size()
            && segments.subList(0, prefix.segments.size()).equals(prefix.segments);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof NodePath other && segments.equals(other.segments));
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        var builder = new StringBuilder();
        for (Object segment : segments) {
            if (segment instanceof Integer index) {
                builder.append('[').append(index).append(']');
            } else {
                String key = (String) segment;
                if (needsQuoting(key)) {
                    builder.append("['").append(key).append("']");
                } else {
                    if (builder.length() > 0) {
                        builder.append('.');
                    }
                    builder.append(key);
                }
            }
        }
        return builder.toString();
    }

    private static boolean needsQuoting(String key) {
        return key.isEmpty() || key.indexOf('.') >= 0 || key.indexOf('[') >= 0 || key.indexOf(']') >= 0;
    }
}
