package work.lcod.config.error;

import work.lcod.config.node.NodePath;
import work.lcod.config.node.Origin;

public final class UnresolvedReferenceException extends ConfigBuildException {
    private final String target;

    public UnresolvedReferenceException(NodePath path, String target, Origin origin) {
        super("unresolved_reference", "Referenced node '" + target + "' does not exist (referenced from '" + path + "')", path, origin);
        this.target = target;
    }

    public String target() {
        return target;
    }
}
