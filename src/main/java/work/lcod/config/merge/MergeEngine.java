package work.lcod.config.merge;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.config.error.MergeTypeConflictException;
import work.lcod.config.node.MergeMode;
import work.lcod.config.node.Node;
import work.lcod.config.node.NodePath;
import work.lcod.config.node.Priority;
import work.lcod.config.node.Tag;

/**
 * Folds an ordered list of trees into one, left to right.
 *
 * <p>Inputs are never modified. A merged tree remembers the trees it was folded from
 * ({@link Node#mergeStages()}); passing it to another merge replays those stages in place of the folded
 * result, so grouping never changes the outcome: {@code merge([merge([a, b]), c])} equals
 * {@code merge([a, merge([b, c])])} even where priorities made an intermediate result drop content that a
 * later stage would have judged differently.</p>
 */
public final class MergeEngine {
    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    public Node merge(List<Node> trees) {
        Objects.requireNonNull(trees, "trees");
        var stages = new ArrayList<Node>();
        for (Node tree : trees) {
            stages.addAll(stagesOf(Objects.requireNonNull(tree, "tree")));
        }
        Node result = null;
        for (int i = 0; i < stages.size(); i++) {
            log.debug("Merge pass {} of {}", i + 1, stages.size());
            Node stage = takeFromEarlierStages(result, stages.get(i));
            result = applyRelocations(mergeAt(NodePath.ROOT, result, stage));
        }
        return result == null ? Node.emptyMapping() : result.mergeStages(stages);
    }

    /**
     * Single merge: {@code incoming} over {@code base}, followed by relocations. {@code base} may be null.
     */
    public Node merge(Node base, Node incoming) {
        Objects.requireNonNull(incoming, "incoming");
        return merge(base == null ? List.of(incoming) : List.of(base, incoming));
    }

    private static List<Node> stagesOf(Node tree) {
        return tree.mergeStages().isEmpty() ? List.of(tree.deepCopy()) : tree.mergeStages();
    }

    /**
     * Resolves {@code !prev} and {@code !clear} in {@code stage} against {@code merged}, which is edited in place:
     * {@code !prev} moves a node out of it, {@code !clear} empties one. Directives naming nothing are left in the
     * tree, so that a later merge replaying this stage after more content can still resolve them.
     */
    private static Node takeFromEarlierStages(Node merged, Node stage) {
        if (!hasEarlierStageDirective(stage)) {
            return stage;
        }
        Node resolved = takeFromEarlierStages(merged, stage.deepCopy(), NodePath.ROOT);
        return resolved == null ? Node.emptyMapping() : resolved;
    }

    private static Node takeFromEarlierStages(Node merged, Node node, NodePath path) {
        if (node.tag().isDirective(Tag.PREV)) {
            return takePrevious(merged, node, path);
        }
        if (node.tag().isDirective(Tag.CLEAR)) {
            return clearPrevious(merged, node, path) ? null : node;
        }
        if (node.isMapping()) {
            for (String key : new ArrayList<>(node.entries().keySet())) {
                Node child = takeFromEarlierStages(merged, node.get(key), path.child(key));
                if (child == null) {
                    node.remove(key);
                } else {
                    node.put(key, child);
                }
            }
        } else if (node.isSequence()) {
            for (int i = 0; i < node.size(); i++) {
                if (node.get(i).tag().isDirective(Tag.CLEAR)) {
                    throw new MergeTypeConflictException(
                        "!clear cannot be a sequence item",
                        path.child(i),
                        node.get(i).origin()
                    );
                }
                node.set(i, takeFromEarlierStages(merged, node.get(i), path.child(i)));
            }
        }
        return node;
    }

    private static Node takePrevious(Node merged, Node directive, NodePath path) {
        NodePath source = NodePath.parse(String.valueOf(directive.scalarValue()));
        Node taken = merged == null ? null : merged.find(source);
        if (taken == null || taken.isDeleteMarker()) {
            log.debug("'{}' at '{}' is not in the trees merged so far", source, path);
            return directive;
        }
        Node parent = merged.find(source.parent());
        Object last = source.last();
        if (last instanceof Integer index) {
            parent.removeAt(index);
        } else {
            parent.remove((String) last);
        }
        log.debug("Moving earlier '{}' to '{}'", source, path);
        return taken;
    }

    private static boolean clearPrevious(Node merged, Node directive, NodePath path) {
        Node existing = merged == null ? null : merged.find(path);
        if (existing == null || existing.isDeleteMarker()) {
            log.debug("Nothing to clear at '{}' in the trees merged so far", path);
            return false;
        }
        if (existing.isScalar()) {
            throw new MergeTypeConflictException(
                "!clear needs a mapping or a sequence, found a scalar",
                path,
                directive.origin()
            );
        }
        if (existing.isMapping()) {
            for (String key : new ArrayList<>(existing.entries().keySet())) {
                existing.remove(key);
            }
        } else {
            while (existing.size() > 0) {
                existing.removeAt(existing.size() - 1);
            }
        }
        return true;
    }

    private static boolean hasEarlierStageDirective(Node node) {
        if (node.tag().isDirective(Tag.PREV) || node.tag().isDirective(Tag.CLEAR)) {
            return true;
        }
        if (node.isMapping()) {
            for (Node child : node.entries().values()) {
                if (hasEarlierStageDirective(child)) {
                    return true;
                }
            }
        } else if (node.isSequence()) {
            for (Node item : node.items()) {
                if (hasEarlierStageDirective(item)) {
                    return true;
                }
            }
        }
        return false;
    }

    private Node mergeAt(NodePath path, Node base, Node incoming) {
        if (incoming.mergeMode() == MergeMode.APPEND && !incoming.isSequence()) {
            throw new MergeTypeConflictException(
                "Append is only valid on sequences, found a " + incoming.kind().name().toLowerCase(),
                path,
                incoming.origin()
            );
        }
        if (base == null) {
            return adopt(incoming);
        }
        if (incoming.isDeleteMarker()) {
            return deleteOnto(base, incoming);
        }
        if (base.isDeleteMarker()) {
            return base.priority().hasPriorityOver(incoming.priority(), false)
                ? base.deepCopy()
                : replacement(incoming);
        }
        if (base.isMapping() && incoming.isMapping()) {
            return mergeMappings(path, base, incoming);
        }
        if (base.isSequence() && incoming.isSequence()) {
            return mergeSequences(path, base, incoming);
        }
        if (base.isSequence() && incoming.isMapping() && incoming.mergeMode() == MergeMode.DEEP_MERGE) {
            return mergeIndexUpdates(path, base, incoming);
        }
        return override(base, incoming);
    }

    private Node mergeMappings(NodePath path, Node base, Node incoming) {
        boolean sameKind = incoming.tag().isPlain() || incoming.tag().equals(base.tag());
        if (!sameKind || incoming.effectiveMergeMode() == MergeMode.REPLACE) {
            if (base.priority().hasPriorityOver(incoming.priority(), false)) {
                return base.deepCopy();
            }
            Node kept = survivors(base, incoming.priority());
            if (kept == null) {
                return replacement(incoming);
            }
            Node merged = mergeEntries(path, kept, incoming);
            merged.copyAttributesFrom(incoming).mergeMode(MergeMode.REPLACE);
            return merged;
        }

        Node merged = mergeEntries(path, base, incoming);
        Node winner = incoming.priority().hasPriorityOver(base.priority(), true) ? incoming : base;
        merged.tag(incoming.tag().isPlain() ? base.tag() : incoming.tag())
            .priority(winner.priority())
            .mergeMode(base.mergeMode() == MergeMode.REPLACE ? MergeMode.REPLACE : incoming.mergeMode())
            .relocation(incoming.relocation())
            .metadata(mergeMetadata(base.metadata(), incoming.metadata()))
            .origin(winner.origin());
        return merged;
    }

    private Node mergeEntries(NodePath path, Node base, Node incoming) {
        Node result = Node.emptyMapping();
        base.entries().forEach((key, child) -> result.put(key, child.deepCopy()));
        incoming.entries().forEach((key, child) -> result.put(key, mergeAt(path.child(key), base.get(key), child)));
        return result;
    }

    private Node mergeSequences(NodePath path, Node base, Node incoming) {
        boolean sameKind = incoming.tag().isPlain() || incoming.tag().equals(base.tag());
        MergeMode mode = incoming.effectiveMergeMode();
        if (!sameKind || mode == MergeMode.REPLACE || base.priority() != incoming.priority()) {
            return override(base, incoming);
        }

        Node merged = Node.emptySequence();
        if (mode == MergeMode.APPEND) {
            base.items().forEach(item -> merged.add(item.deepCopy()));
            for (Node item : incoming.items()) {
                if (!item.isDeleteMarker()) {
                    merged.add(adopt(item));
                }
            }
        } else {
            int shared = Math.min(base.size(), incoming.size());
            for (int i = 0; i < Math.max(base.size(), incoming.size()); i++) {
                Node item = i < shared
                    ? mergeAt(path.child(i), base.get(i), incoming.get(i))
                    : i < base.size() ? base.get(i).deepCopy() : adopt(incoming.get(i));
                if (!item.isDeleteMarker()) {
                    merged.add(item);
                }
            }
        }
        merged.tag(incoming.tag().isPlain() ? base.tag() : incoming.tag())
            .priority(incoming.priority())
            .mergeMode(base.mergeMode())
            .relocation(incoming.relocation())
            .metadata(mergeMetadata(base.metadata(), incoming.metadata()))
            .origin(incoming.origin());
        return merged;
    }

    /**
     * {@code !merge {1: x}} over a sequence updates the listed indices; index {@code size} appends.
     */
    private Node mergeIndexUpdates(NodePath path, Node base, Node incoming) {
        if (base.priority().hasPriorityOver(incoming.priority(), false)) {
            return base.deepCopy();
        }
        var updated = new ArrayList<Node>(base.size());
        base.items().forEach(item -> updated.add(item.deepCopy()));
        for (var entry : incoming.entries().entrySet()) {
            int index = parseIndex(path, entry.getKey(), incoming);
            if (index < updated.size()) {
                updated.set(index, mergeAt(path.child(index), updated.get(index), entry.getValue()));
            } else if (index == updated.size()) {
                updated.add(adopt(entry.getValue()));
            } else {
                throw new MergeTypeConflictException(
                    "Index " + index + " is out of range for a sequence of size " + updated.size(),
                    path,
                    incoming.origin()
                );
            }
        }
        Node merged = Node.emptySequence();
        for (Node item : updated) {
            if (!item.isDeleteMarker()) {
                merged.add(item);
            }
        }
        merged.copyAttributesFrom(base)
            .relocation(incoming.relocation())
            .metadata(mergeMetadata(base.metadata(), incoming.metadata()));
        return merged;
    }

    private static int parseIndex(NodePath path, String key, Node incoming) {
        try {
            int index = Integer.parseInt(key.trim());
            if (index >= 0) {
                return index;
            }
        } catch (NumberFormatException ex) {
            throw new MergeTypeConflictException(
                "Cannot merge key '" + key + "' into a sequence: keys must be indices",
                path,
                incoming.origin()
            );
        }
        throw new MergeTypeConflictException("Negative sequence index " + key, path, incoming.origin());
    }

    private Node deleteOnto(Node base, Node marker) {
        if (base.priority().hasPriorityOver(marker.priority(), false)) {
            log.debug("Delete ignored, existing node has priority {}", base.priority());
            return base.deepCopy();
        }
        if (base.isDeleteMarker()) {
            return marker.deepCopy();
        }
        Node kept = survivors(base, marker.priority());
        if (kept == null) {
            return marker.deepCopy();
        }
        return kept.mergeMode(MergeMode.REPLACE)
            .priority(marker.priority())
            .origin(marker.origin());
    }

    /**
     * Copy of the parts of {@code node} that rank strictly above {@code threshold}, or null when nothing does.
     */
    private static Node survivors(Node node, Priority threshold) {
        if (node.priority().hasPriorityOver(threshold, false)) {
            return node.deepCopy();
        }
        if (!node.isMapping()) {
            return null;
        }
        Node kept = null;
        for (var entry : node.entries().entrySet()) {
            Node child = survivors(entry.getValue(), threshold);
            if (child != null) {
                if (kept == null) {
                    kept = Node.emptyMapping().copyAttributesFrom(node);
                }
                kept.put(entry.getKey(), child);
            }
        }
        return kept;
    }

    private Node override(Node base, Node incoming) {
        if (base.priority().hasPriorityOver(incoming.priority(), false)) {
            return base.deepCopy();
        }
        return replacement(incoming);
    }

    /**
     * Incoming content that displaced whatever was there before. Containers are marked {@code REPLACE}
     * so that the displacement still applies if this result is later merged over older trees.
     */
    private static Node replacement(Node incoming) {
        Node adopted = adopt(incoming);
        if (!adopted.isScalar() && !adopted.isDeleteMarker()) {
            adopted.mergeMode(MergeMode.REPLACE);
        }
        return adopted;
    }

    private static Node adopt(Node incoming) {
        return dropDeletedItems(incoming.deepCopy());
    }

    private static Node dropDeletedItems(Node node) {
        if (node.isSequence()) {
            for (int i = node.size() - 1; i >= 0; i--) {
                if (node.get(i).isDeleteMarker()) {
                    node.removeAt(i);
                } else {
                    dropDeletedItems(node.get(i));
                }
            }
        } else if (node.isMapping()) {
            node.entries().values().forEach(MergeEngine::dropDeletedItems);
        }
        return node;
    }

    private static Map<String, Object> mergeMetadata(Map<String, Object> earlier, Map<String, Object> later) {
        if (earlier.isEmpty()) {
            return later;
        }
        if (later.isEmpty()) {
            return earlier;
        }
        var merged = new LinkedHashMap<String, Object>(earlier);
        merged.putAll(later);
        return merged;
    }

    private Node applyRelocations(Node root) {
        if (root.relocation() != null) {
            throw new MergeTypeConflictException("The root node cannot be relocated", NodePath.ROOT, root.origin());
        }
        Node current = root;
        NodePath source;
        while ((source = findRelocated(current, NodePath.ROOT)) != null) {
            Node parent = current.find(source.parent());
            Object last = source.last();
            Node moved = last instanceof Integer index ? parent.removeAt(index) : parent.remove((String) last);
            NodePath target = moved.relocation().candidates(source).get(0);
            moved.relocation(null);
            if (moved.isDeleteMarker()) {
                log.debug("Dropping relocated delete marker at '{}'", source);
                continue;
            }
            log.debug("Relocating '{}' to '{}'", source, target);
            current = splice(current, target, moved);
        }
        return current;
    }

    private static NodePath findRelocated(Node node, NodePath path) {
        if (!path.isRoot() && node.relocation() != null) {
            return path;
        }
        if (node.isMapping()) {
            for (var entry : node.entries().entrySet()) {
                NodePath found = findRelocated(entry.getValue(), path.child(entry.getKey()));
                if (found != null) {
                    return found;
                }
            }
        } else if (node.isSequence()) {
            for (int i = 0; i < node.size(); i++) {
                NodePath found = findRelocated(node.get(i), path.child(i));
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    private Node splice(Node root, NodePath target, Node moved) {
        if (target.isRoot()) {
            return mergeAt(NodePath.ROOT, root, moved);
        }
        Node parent = root;
        NodePath walked = NodePath.ROOT;
        for (int i = 0; i < target.size() - 1; i++) {
            Object segment = target.segment(i);
            Node next = parent.child(segment);
            if (next == null || next.isDeleteMarker()) {
                if (!(segment instanceof String key) || !parent.isMapping()) {
                    throw relocationConflict(target, walked, moved);
                }
                next = Node.emptyMapping();
                parent.put(key, next);
            } else if (next.isScalar()) {
                throw relocationConflict(target, walked.append(NodePath.of(segment)), moved);
            }
            walked = walked.append(NodePath.of(segment));
            parent = next;
        }

        Object last = target.last();
        if (last instanceof Integer index) {
            if (!parent.isSequence() || index > parent.size()) {
                throw relocationConflict(target, walked, moved);
            }
            if (index == parent.size()) {
                parent.add(moved);
            } else {
                parent.set(index, mergeAt(target, parent.get(index), moved));
            }
        } else {
            if (!parent.isMapping()) {
                throw relocationConflict(target, walked, moved);
            }
            String key = (String) last;
            Node existing = parent.get(key);
            parent.put(key, existing == null ? moved : mergeAt(target, existing, moved));
        }
        return root;
    }

    private static MergeTypeConflictException relocationConflict(NodePath target, NodePath blocking, Node moved) {
        String at = blocking.isRoot() ? "<root>" : blocking.toString();
        return new MergeTypeConflictException(
            "Cannot relocate a node to '" + target + "': '" + at + "' cannot hold it",
            target,
            moved.origin()
        );
    }
}
