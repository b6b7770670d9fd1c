package work.lcod.config.error;

import java.util.List;
import java.util.stream.Collectors;
import work.lcod.config.node.NodePath;

/**
 * Deferred nodes depend on each other in a loop. {@link #cycle()} lists the participants in dependency order.
 */
public final class DependencyCycleException extends ConfigBuildException {
    private final List<NodePath> cycle;

    public DependencyCycleException(List<NodePath> cycle) {
        super("dependency_cycle", "Dependency cycle detected: " + render(cycle), cycle.get(0), null);
        this.cycle = List.copyOf(cycle);
    }

    private static String render(List<NodePath> cycle) {
        String chain = cycle.stream().map(path -> "'" + path + "'").collect(Collectors.joining(" -> "));
        return chain + " -> '" + cycle.get(0) + "'";
    }

    public List<NodePath> cycle() {
        return cycle;
    }
}
