package work.lcod.config.error;

import work.lcod.config.node.NodePath;
import work.lcod.config.node.Origin;

/**
 * A deferred expression whose operands cannot be combined, e.g. a path join over a mapping.
 */
public final class EvaluationException extends ConfigBuildException {
    public EvaluationException(String message, NodePath path, Origin origin) {
        super("evaluation_error", message, path, origin);
    }

    public EvaluationException(String message, NodePath path, Origin origin, Throwable cause) {
        super("evaluation_error", message, path, origin, cause);
    }
}
