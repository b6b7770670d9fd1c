package work.lcod.config.error;

import work.lcod.config.node.NodePath;
import work.lcod.config.node.Origin;

public final class MergeTypeConflictException extends ConfigBuildException {
    public MergeTypeConflictException(String message, NodePath path, Origin origin) {
        super("merge_conflict", message, path, origin);
    }
}
