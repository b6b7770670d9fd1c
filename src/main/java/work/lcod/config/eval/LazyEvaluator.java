package work.lcod.config.eval;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.config.error.ConfigBuildException;
import work.lcod.config.error.DynamicProviderException;
import work.lcod.config.error.EvaluationException;
import work.lcod.config.error.MissingRequiredValueException;
import work.lcod.config.error.UnresolvedReferenceException;
import work.lcod.config.node.Node;
import work.lcod.config.node.NodePath;
import work.lcod.config.node.Tag;

/**
 * Turns a merged tree into a concrete one by computing its deferred nodes in dependency order.
 * The input tree is left untouched. Instances hold no per-build state and may be shared.
 */
public final class LazyEvaluator {
    private static final Logger log = LoggerFactory.getLogger(LazyEvaluator.class);

    private final DynamicProvider dynamicProvider;
    private final Path workingDirectory;
    private final ReferenceGraphBuilder graphBuilder = new ReferenceGraphBuilder();

    public LazyEvaluator() {
        this(null);
    }

    public LazyEvaluator(DynamicProvider dynamicProvider) {
        this(dynamicProvider, Path.of("").toAbsolutePath());
    }

    /**
     * @param dynamicProvider computes dynamic expressions; null rejects them
     * @param workingDirectory base of {@code !path:cwd}
     */
    public LazyEvaluator(DynamicProvider dynamicProvider, Path workingDirectory) {
        this.dynamicProvider = dynamicProvider;
        this.workingDirectory = workingDirectory == null ? Path.of("").toAbsolutePath() : workingDirectory;
    }

    public Node evaluate(Node merged) {
        Node tree = merged.isDeleteMarker() ? Node.emptyMapping() : merged.deepCopy();
        pruneDeleted(tree);
        rejectDirectives(tree, NodePath.ROOT);
        var missing = new ArrayList<NodePath>();
        collectRequired(tree, NodePath.ROOT, missing);
        if (!missing.isEmpty()) {
            throw new MissingRequiredValueException(missing, tree.find(missing.get(0)).origin());
        }

        ReferenceGraph graph = graphBuilder.build(tree);
        List<NodePath> order = graph.evaluationOrder();
        log.debug("Evaluating {} deferred node(s) in order {}", order.size(), order);
        for (NodePath path : order) {
            Node deferred = tree.find(path);
            Node value = compute(tree, deferred, graph.vertex(path));
            value.priority(deferred.priority()).metadata(deferred.metadata()).origin(deferred.origin());
            log.trace("'{}' = {}", path, value);
            tree = replace(tree, path, value);
        }
        assertConcrete(tree, NodePath.ROOT);
        return tree;
    }

    private Node compute(Node tree, Node deferred, ReferenceGraph.Vertex vertex) {
        NodePath path = vertex.path();
        Tag tag = deferred.tag();
        if (tag.category() == Tag.Category.DYNAMIC) {
            return Node.from(callProvider(tree, deferred, vertex)).deepCopy();
        }
        switch (tag.name()) {
            case Tag.REF: {
                String target = String.valueOf(deferred.scalarValue());
                return Node.from(read(tree, vertex, target, deferred));
            }
            case Tag.FSTR: {
                Interpolation template = Interpolation.parse(String.valueOf(deferred.scalarValue()));
                return Node.scalar(template.render(target -> read(tree, vertex, target, deferred)));
            }
            case Tag.PATH: {
                if (!deferred.isSequence()) {
                    throw new EvaluationException("!path expects a list of segments", path, deferred.origin());
                }
                var segments = new ArrayList<Object>();
                for (Node item : deferred.items()) {
                    segments.add(item.toPlain());
                }
                return Node.scalar(PathJoin.join(tag.argument(), segments, path, deferred.origin(), workingDirectory));
            }
            case Tag.REQUIRED:
                throw new MissingRequiredValueException(List.of(path), deferred.origin());
            default:
                throw new EvaluationException("No evaluation rule for " + tag, path, deferred.origin());
        }
    }

    private Object read(Node tree, ReferenceGraph.Vertex vertex, String target, Node deferred) {
        ReferenceGraph.Read read = vertex.read(target);
        if (read == null || !read.isResolved()) {
            throw new UnresolvedReferenceException(vertex.path(), target, deferred.origin());
        }
        Node value = tree.find(read.resolved());
        if (value == null) {
            throw new UnresolvedReferenceException(vertex.path(), target, deferred.origin());
        }
        return value.toPlain();
    }

    private Object callProvider(Node tree, Node deferred, ReferenceGraph.Vertex vertex) {
        NodePath path = vertex.path();
        Tag tag = deferred.tag();
        if (dynamicProvider == null) {
            throw new DynamicProviderException("No dynamic provider configured for " + tag, path, deferred.origin());
        }
        var dependencies = new LinkedHashMap<NodePath, Object>();
        for (NodePath operand : vertex.operands()) {
            dependencies.put(operand, tree.find(operand).toPlain());
        }
        var expression = new DynamicExpression(tag.name(), tag.argument(), deferred.toPlain(), path, deferred.origin());
        try {
            return dynamicProvider.evaluate(expression, Collections.unmodifiableMap(dependencies));
        } catch (ConfigBuildException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new DynamicProviderException(tag + " failed: " + ex.getMessage(), path, deferred.origin(), ex);
        }
    }

    private static Node replace(Node tree, NodePath path, Node value) {
        if (path.isRoot()) {
            return value;
        }
        tree.find(path.parent()).replaceChild(path.last(), value);
        return tree;
    }

    private static void pruneDeleted(Node node) {
        if (node.isMapping()) {
            for (String key : new ArrayList<>(node.entries().keySet())) {
                if (node.get(key).isDeleteMarker()) {
                    node.remove(key);
                } else {
                    pruneDeleted(node.get(key));
                }
            }
        } else if (node.isSequence()) {
            for (int i = node.size() - 1; i >= 0; i--) {
                if (node.get(i).isDeleteMarker()) {
                    node.removeAt(i);
                } else {
                    pruneDeleted(node.get(i));
                }
            }
        }
    }

    private static void rejectDirectives(Node node, NodePath path) {
        if (node.tag().isDirective(Tag.PREV)) {
            throw new UnresolvedReferenceException(path, String.valueOf(node.scalarValue()), node.origin());
        }
        if (node.tag().isDirective(Tag.CLEAR)) {
            throw new EvaluationException("!clear found nothing to clear in the earlier sources", path, node.origin());
        }
        if (node.tag().category() == Tag.Category.DIRECTIVE) {
            throw new EvaluationException(node.tag() + " was not expanded before evaluation", path, node.origin());
        }
        forEachChild(node, path, LazyEvaluator::rejectDirectives);
    }

    private static void collectRequired(Node node, NodePath path, List<NodePath> missing) {
        if (node.tag().is(Tag.REQUIRED) && node.tag().category() == Tag.Category.DEFERRED) {
            missing.add(path);
        }
        forEachChild(node, path, (child, childPath) -> collectRequired(child, childPath, missing));
    }

    private static void assertConcrete(Node node, NodePath path) {
        if (!node.tag().isPlain()) {
            throw new EvaluationException(node.tag() + " is still unevaluated", path, node.origin());
        }
        forEachChild(node, path, LazyEvaluator::assertConcrete);
    }

    private static void forEachChild(Node node, NodePath path, BiConsumer<Node, NodePath> action) {
        if (node.isMapping()) {
            node.entries().forEach((key, child) -> action.accept(child, path.child(key)));
        } else if (node.isSequence()) {
            for (int i = 0; i < node.size(); i++) {
                action.accept(node.get(i), path.child(i));
            }
        }
    }
}
