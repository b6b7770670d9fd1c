package work.lcod.config.eval;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.config.error.DependencyCycleException;
import work.lcod.config.node.NodePath;
import work.lcod.config.node.Tag;

/**
 * Dependency graph over the deferred nodes of one tree. Vertices are kept in document order and each
 * points at the vertices it needs evaluated first.
 */
public final class ReferenceGraph {
    private final Map<NodePath, Vertex> vertices;

    private ReferenceGraph(Map<NodePath, Vertex> vertices) {
        this.vertices = vertices;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Vertex> vertices() {
        return List.copyOf(vertices.values());
    }

    public Vertex vertex(NodePath path) {
        return vertices.get(path);
    }

    public int size() {
        return vertices.size();
    }

    /**
     * Reads that point at nothing in the tree. They only fail the build when their vertex is evaluated.
     */
    public List<Read> unresolved() {
        var unresolved = new ArrayList<Read>();
        for (Vertex vertex : vertices.values()) {
            vertex.reads().stream().filter(read -> !read.isResolved()).forEach(unresolved::add);
        }
        return unresolved;
    }

    /**
     * Dependencies-first order (Kahn's algorithm, ties broken by document order).
     *
     * @throws DependencyCycleException naming one cycle when the vertices cannot all be ordered
     */
    public List<NodePath> evaluationOrder() {
        var remaining = new HashMap<NodePath, Integer>();
        var dependents = new HashMap<NodePath, List<NodePath>>();
        for (Vertex vertex : vertices.values()) {
            remaining.put(vertex.path(), vertex.dependencies().size());
            for (NodePath dependency : vertex.dependencies()) {
                dependents.computeIfAbsent(dependency, key -> new ArrayList<>()).add(vertex.path());
            }
        }

        Deque<NodePath> ready = new ArrayDeque<>();
        for (Vertex vertex : vertices.values()) {
            if (vertex.dependencies().isEmpty()) {
                ready.add(vertex.path());
            }
        }
        var order = new ArrayList<NodePath>(vertices.size());
        while (!ready.isEmpty()) {
            NodePath current = ready.poll();
            order.add(current);
            for (NodePath dependent : dependents.getOrDefault(current, List.of())) {
                if (remaining.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (order.size() != vertices.size()) {
            var unordered = new LinkedHashSet<>(vertices.keySet());
            order.forEach(unordered::remove);
            throw new DependencyCycleException(findCycle(unordered));
        }
        return order;
    }

    private List<NodePath> findCycle(Set<NodePath> unordered) {
        var state = new HashMap<NodePath, Visit>();
        var stack = new ArrayList<NodePath>();
        for (NodePath start : unordered) {
            if (state.getOrDefault(start, Visit.UNVISITED) == Visit.UNVISITED) {
                List<NodePath> cycle = visit(start, unordered, state, stack);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        // every unordered vertex has an unordered dependency, so a cycle always exists
        throw new IllegalStateException("No cycle found among " + unordered);
    }

    private List<NodePath> visit(NodePath path, Set<NodePath> unordered, Map<NodePath, Visit> state, List<NodePath> stack) {
        state.put(path, Visit.IN_PROGRESS);
        stack.add(path);
        for (NodePath dependency : vertices.get(path).dependencies()) {
            if (!unordered.contains(dependency)) {
                continue;
            }
            Visit visit = state.getOrDefault(dependency, Visit.UNVISITED);
            if (visit == Visit.IN_PROGRESS) {
                return new ArrayList<>(stack.subList(stack.indexOf(dependency), stack.size()));
            }
            if (visit == Visit.UNVISITED) {
                List<NodePath> cycle = visit(dependency, unordered, state, stack);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        stack.remove(stack.size() - 1);
        state.put(path, Visit.DONE);
        return null;
    }

    private enum Visit {
        UNVISITED,
        IN_PROGRESS,
        DONE
    }

    /**
     * One path read by a deferred node.
     *
     * @param from path of the reading node
     * @param target the path as written
     * @param resolved absolute path it resolved to, or null when nothing in the tree matches
     */
    public record Read(NodePath from, String target, NodePath resolved) {
        public boolean isResolved() {
            return resolved != null;
        }
    }

    /**
     * @param operands deferred nodes nested inside this one (arguments of a path join or a dynamic expression)
     * @param dependencies every vertex that must be evaluated before this one
     */
    public record Vertex(NodePath path, Tag tag, List<Read> reads, List<NodePath> operands, List<NodePath> dependencies) {
        public Read read(String target) {
            for (Read read : reads) {
                if (read.target().equals(target)) {
                    return read;
                }
            }
            return null;
        }
    }

    public static final class Builder {
        private final Map<NodePath, Tag> tags = new LinkedHashMap<>();
        private final Map<NodePath, List<Read>> reads = new HashMap<>();
        private final Map<NodePath, Set<NodePath>> operands = new HashMap<>();
        private final Map<NodePath, Set<NodePath>> edges = new HashMap<>();

        public Builder addVertex(NodePath path, Tag tag) {
            if (tags.containsKey(path)) {
                throw new IllegalArgumentException("Duplicate vertex: " + path);
            }
            tags.put(path, tag);
            reads.put(path, new ArrayList<>());
            operands.put(path, new LinkedHashSet<>());
            edges.put(path, new LinkedHashSet<>());
            return this;
        }

        public Builder addRead(Read read) {
            requireVertex(read.from());
            reads.get(read.from()).add(read);
            return this;
        }

        public Builder addOperand(NodePath from, NodePath operand) {
            operands.get(requireVertex(from)).add(operand);
            return addEdge(from, operand);
        }

        public Builder addEdge(NodePath from, NodePath to) {
            requireVertex(to);
            edges.get(requireVertex(from)).add(to);
            return this;
        }

        private NodePath requireVertex(NodePath path) {
            if (!tags.containsKey(path)) {
                throw new IllegalArgumentException("Unknown vertex: " + path);
            }
            return path;
        }

        public ReferenceGraph build() {
            var vertices = new LinkedHashMap<NodePath, Vertex>();
            tags.forEach((path, tag) -> vertices.put(path, new Vertex(
                path,
                tag,
                List.copyOf(reads.get(path)),
                List.copyOf(operands.get(path)),
                List.copyOf(edges.get(path))
            )));
            return new ReferenceGraph(Collections.unmodifiableMap(vertices));
        }
    }
}
