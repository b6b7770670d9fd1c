package work.lcod.config.error;

import work.lcod.config.node.NodePath;
import work.lcod.config.node.Origin;

/**
 * Base of every failure raised while building a configuration tree. Carries a stable error code,
 * the offending tree path and, when known, the provenance of the node involved.
 */
public class ConfigBuildException extends RuntimeException {
    private final String code;
    private final NodePath path;
    private final Origin origin;

    public ConfigBuildException(String code, String message, NodePath path, Origin origin) {
        this(code, message, path, origin, null);
    }

    public ConfigBuildException(String code, String message, NodePath path, Origin origin, Throwable cause) {
        super(decorate(message, path, origin), cause);
        this.code = code;
        this.path = path;
        this.origin = origin;
    }

    private static String decorate(String message, NodePath path, Origin origin) {
        var builder = new StringBuilder(message);
        if (path != null && !message.contains("'" + path + "'")) {
            builder.append(" [path: ").append(path.isRoot() ? "<root>" : path.toString()).append(']');
        }
        if (origin != null && origin.source() != null) {
            builder.append(" (from ").append(origin.describe()).append(')');
        }
        return builder.toString();
    }

    public String code() {
        return code;
    }

    public NodePath path() {
        return path;
    }

    public Origin origin() {
        return origin;
    }
}
