package work.lcod.config.error;

import java.util.List;
import work.lcod.config.node.NodePath;
import work.lcod.config.node.Origin;

/**
 * A source includes itself, directly or through other sources.
 */
public final class IncludeCycleException extends ConfigBuildException {
    private final List<String> chain;

    public IncludeCycleException(List<String> chain, NodePath path, Origin origin) {
        super("include_cycle", "Include cycle detected: " + String.join(" -> ", chain), path, origin);
        this.chain = List.copyOf(chain);
    }

    public List<String> chain() {
        return chain;
    }
}
