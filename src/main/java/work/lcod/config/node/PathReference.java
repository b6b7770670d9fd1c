package work.lcod.config.node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A path written inside a tree, such as the target of a reference or a relocation.
 * Text without leading dots is absolute. Each leading dot makes it relative: {@code .x} names a sibling
 * of the referencing node, {@code ..x} a sibling of its parent, and so on.
 */
public record PathReference(String raw, boolean relative, int up, NodePath path) {
    public PathReference {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(path, "path");
    }

    public static PathReference parse(String raw) {
        Objects.requireNonNull(raw, "raw");
        String text = raw.trim();
        int dots = 0;
        while (dots < text.length() && text.charAt(dots) == '.') {
            dots++;
        }
        NodePath path = NodePath.parse(text.substring(dots));
        return new PathReference(raw, dots > 0, Math.max(0, dots - 1), path);
    }

    /**
     * Absolute paths this reference may denote when written at {@code from}, nearest scope first.
     * Relative references walk upward from their starting scope to the root.
     */
    public List<NodePath> candidates(NodePath from) {
        if (!relative) {
            return List.of(path);
        }
        NodePath scope = from.parent();
        for (int i = 0; i < up; i++) {
            scope = scope.parent();
        }
        var candidates = new ArrayList<NodePath>();
        while (true) {
            candidates.add(scope.append(path));
            if (scope.isRoot()) {
                break;
            }
            scope = scope.parent();
        }
        return candidates;
    }

    @Override
    public String toString() {
        return raw;
    }
}
