package work.lcod.config.eval;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.config.error.EvaluationException;
import work.lcod.config.error.ParseException;
import work.lcod.config.node.Node;
import work.lcod.config.node.NodePath;
import work.lcod.config.node.PathReference;
import work.lcod.config.node.Tag;

/**
 * Scans a merged tree for deferred nodes and records which paths each of them reads.
 *
 * <p>A deferred node depends on the deferred nodes nested in its own value, on the outermost deferred
 * nodes found at or below every path it reads, and on a deferred node sitting on the way to such a path
 * (the rest of the path is then looked up in that node's computed value). The exception is a deferred
 * node enclosing the reader, such as a call whose arguments refer to each other: the path is followed
 * through its written arguments. Reads that match nothing are kept as unresolved and left for the
 * evaluator to report.</p>
 */
public final class ReferenceGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(ReferenceGraphBuilder.class);

    public ReferenceGraph build(Node root) {
        var builder = ReferenceGraph.builder();
        var deferred = new ArrayList<NodePath>();
        collect(root, NodePath.ROOT, deferred);
        for (NodePath path : deferred) {
            builder.addVertex(path, root.find(path).tag());
        }
        for (NodePath path : deferred) {
            Node node = root.find(path);
            for (NodePath operand : outermostBelow(node, path)) {
                builder.addOperand(path, operand);
            }
            for (String target : readsOf(node, path)) {
                ReferenceGraph.Read read = resolve(root, path, target, node);
                builder.addRead(read);
                if (read.isResolved()) {
                    for (NodePath dependency : dependenciesOf(root, path, read.resolved())) {
                        builder.addEdge(path, dependency);
                    }
                } else {
                    log.debug("Reference '{}' at '{}' matches nothing in the tree", target, path);
                }
            }
        }
        return builder.build();
    }

    private static void collect(Node node, NodePath path, List<NodePath> deferred) {
        if (node.tag().isDeferred()) {
            deferred.add(path);
        }
        if (node.isMapping()) {
            node.entries().forEach((key, child) -> collect(child, path.child(key), deferred));
        } else if (node.isSequence()) {
            for (int i = 0; i < node.size(); i++) {
                collect(node.get(i), path.child(i), deferred);
            }
        }
    }

    /**
     * Deferred nodes strictly below {@code node} that have no deferred ancestor between them and it.
     */
    private static List<NodePath> outermostBelow(Node node, NodePath path) {
        var found = new ArrayList<NodePath>();
        if (node.isMapping()) {
            node.entries().forEach((key, child) -> outermost(child, path.child(key), found));
        } else if (node.isSequence()) {
            for (int i = 0; i < node.size(); i++) {
                outermost(node.get(i), path.child(i), found);
            }
        }
        return found;
    }

    private static void outermost(Node node, NodePath path, List<NodePath> found) {
        if (node.tag().isDeferred()) {
            found.add(path);
            return;
        }
        found.addAll(outermostBelow(node, path));
    }

    private static List<String> readsOf(Node node, NodePath path) {
        Tag tag = node.tag();
        if (tag.category() != Tag.Category.DEFERRED) {
            return List.of();
        }
        if (tag.is(Tag.REF)) {
            return List.of(String.valueOf(node.scalarValue()));
        }
        if (tag.is(Tag.FSTR)) {
            try {
                return Interpolation.parse(String.valueOf(node.scalarValue())).placeholders();
            } catch (IllegalArgumentException ex) {
                throw new EvaluationException("Invalid !fstr template: " + ex.getMessage(), path, node.origin(), ex);
            }
        }
        return List.of();
    }

    private static ReferenceGraph.Read resolve(Node root, NodePath from, String target, Node node) {
        PathReference reference;
        try {
            reference = PathReference.parse(target);
        } catch (IllegalArgumentException ex) {
            throw new ParseException("Invalid reference '" + target + "': " + ex.getMessage(), from, node.origin(), ex);
        }
        for (NodePath candidate : reference.candidates(from)) {
            if (dependenciesOf(root, from, candidate) != null) {
                return new ReferenceGraph.Read(from, target, candidate);
            }
        }
        return new ReferenceGraph.Read(from, target, null);
    }

    /**
     * Deferred nodes a read of {@code target} from {@code from} has to wait for, or null when the target leads
     * nowhere. A deferred node met on the way is waited for as a whole, unless it encloses the reader: its
     * arguments are then read as they are written.
     */
    static List<NodePath> dependenciesOf(Node root, NodePath from, NodePath target) {
        Node current = root;
        NodePath prefix = NodePath.ROOT;
        NodePath enclosing = null;
        for (Object segment : target.segments()) {
            if (current.tag().isDeferred()) {
                if (!encloses(prefix, from)) {
                    return List.of(prefix);
                }
                enclosing = prefix;
            }
            Node next = current.child(segment);
            if (next == null) {
                return enclosing == null ? null : List.of(enclosing);
            }
            current = next;
            prefix = segment instanceof Integer index ? prefix.child(index) : prefix.child((String) segment);
        }
        var dependencies = new ArrayList<NodePath>();
        outermost(current, target, dependencies);
        return dependencies;
    }

    private static boolean encloses(NodePath ancestor, NodePath path) {
        return path.size() > ancestor.size() && path.startsWith(ancestor);
    }
}
