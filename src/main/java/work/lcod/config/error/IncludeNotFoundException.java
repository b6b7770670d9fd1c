package work.lcod.config.error;

import work.lcod.config.node.NodePath;
import work.lcod.config.node.Origin;

public final class IncludeNotFoundException extends ConfigBuildException {
    private final String target;

    public IncludeNotFoundException(String target, NodePath path, Origin origin) {
        super("include_not_found", "Cannot locate included source '" + target + "'", path, origin);
        this.target = target;
    }

    public String target() {
        return target;
    }
}
