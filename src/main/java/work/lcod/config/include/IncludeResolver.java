package work.lcod.config.include;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.config.error.IncludeCycleException;
import work.lcod.config.error.IncludeNotFoundException;
import work.lcod.config.error.ParseException;
import work.lcod.config.merge.MergeEngine;
import work.lcod.config.node.Node;
import work.lcod.config.node.NodePath;
import work.lcod.config.node.Priority;
import work.lcod.config.node.Tag;

/**
 * Replaces {@code !include} directives with the merged content of the sources they name.
 *
 * <p>One resolver serves one build: every source it loads is cached (and handed out as a copy) for the
 * rest of that build, and the sources currently being loaded form the stack used to detect cycles.</p>
 */
public final class IncludeResolver {
    private static final Logger log = LoggerFactory.getLogger(IncludeResolver.class);

    private final TreeSourceProvider provider;
    private final IncludeLookup lookup;
    private final MergeEngine mergeEngine;
    private final Map<SourceRef, Node> cache = new HashMap<>();
    private final Deque<SourceRef> active = new ArrayDeque<>();

    public IncludeResolver(TreeSourceProvider provider, IncludeLookup lookup, MergeEngine mergeEngine) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.lookup = Objects.requireNonNull(lookup, "lookup");
        this.mergeEngine = Objects.requireNonNull(mergeEngine, "mergeEngine");
    }

    /**
     * Reads a top-level source and expands its includes. Returns one tree per document, in order.
     */
    public List<Node> load(SourceRef source) {
        checkCycle(source, NodePath.ROOT, null);
        active.push(source);
        try {
            log.debug("Loading source {}", source.name());
            var expanded = new ArrayList<Node>();
            for (Node document : provider.read(source)) {
                expanded.add(expand(document, source));
            }
            return expanded;
        } finally {
            active.pop();
        }
    }

    /**
     * Copy of {@code tree} with every include directive replaced. Relative targets resolve against {@code requester}.
     */
    public Node expand(Node tree, SourceRef requester) {
        return expandAt(tree.deepCopy(), NodePath.ROOT, requester);
    }

    private Node expandAt(Node node, NodePath path, SourceRef requester) {
        if (node.tag().is(Tag.INCLUDE) && node.tag().category() == Tag.Category.DIRECTIVE) {
            return include(node, path, requester);
        }
        if (node.isMapping()) {
            for (String key : new ArrayList<>(node.entries().keySet())) {
                node.put(key, expandAt(node.get(key), path.child(key), requester));
            }
        } else if (node.isSequence()) {
            for (int i = 0; i < node.size(); i++) {
                node.set(i, expandAt(node.get(i), path.child(i), requester));
            }
        }
        return node;
    }

    private Node include(Node directive, NodePath path, SourceRef requester) {
        var trees = new ArrayList<Node>();
        for (String target : targets(directive, path)) {
            SourceRef source = lookup.locate(target, requester)
                .orElseThrow(() -> new IncludeNotFoundException(target, path, directive.origin()));
            trees.add(loadMerged(source, path, directive));
        }
        Node merged = mergeEngine.merge(trees);
        if (directive.priority() != Priority.DEFAULT) {
            merged.priority(directive.priority());
        }
        if (directive.mergeMode() != null) {
            merged.mergeMode(directive.mergeMode());
        }
        if (directive.relocation() != null) {
            merged.relocation(directive.relocation());
        }
        if (!directive.metadata().isEmpty()) {
            var metadata = new LinkedHashMap<>(merged.metadata());
            metadata.putAll(directive.metadata());
            merged.metadata(metadata);
        }
        return merged;
    }

    private Node loadMerged(SourceRef source, NodePath path, Node directive) {
        checkCycle(source, path, directive);
        Node cached = cache.get(source);
        if (cached != null) {
            log.debug("Reusing already loaded source {}", source.name());
            return cached.deepCopy();
        }
        active.push(source);
        try {
            log.debug("Including {} at '{}'", source.name(), path);
            var documents = new ArrayList<Node>();
            for (Node document : provider.read(source)) {
                documents.add(expand(document, source));
            }
            Node merged = mergeEngine.merge(documents);
            cache.put(source, merged);
            return merged.deepCopy();
        } finally {
            active.pop();
        }
    }

    private void checkCycle(SourceRef source, NodePath path, Node directive) {
        if (!active.contains(source)) {
            return;
        }
        var chain = new ArrayList<String>();
        active.descendingIterator().forEachRemaining(ref -> chain.add(ref.name()));
        chain.add(source.name());
        throw new IncludeCycleException(chain, path, directive == null ? null : directive.origin());
    }

    private static List<String> targets(Node directive, NodePath path) {
        if (directive.isScalar() && directive.scalarValue() instanceof String target && !target.isBlank()) {
            return List.of(target.trim());
        }
        if (directive.isSequence() && directive.size() > 0) {
            var targets = new ArrayList<String>();
            for (Node item : directive.items()) {
                if (!(item.scalarValue() instanceof String target) || target.isBlank()) {
                    throw invalidTargets(path, directive);
                }
                targets.add(target.trim());
            }
            return targets;
        }
        throw invalidTargets(path, directive);
    }

    private static ParseException invalidTargets(NodePath path, Node directive) {
        return new ParseException("!include expects a file name or a list of file names", path, directive.origin());
    }
}
