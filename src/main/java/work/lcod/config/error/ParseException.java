package work.lcod.config.error;

import work.lcod.config.node.NodePath;
import work.lcod.config.node.Origin;

/**
 * Malformed source text, or a directive whose payload has the wrong shape.
 */
public final class ParseException extends ConfigBuildException {
    public ParseException(String message, NodePath path, Origin origin) {
        super("parse_error", message, path, origin);
    }

    public ParseException(String message, NodePath path, Origin origin, Throwable cause) {
        super("parse_error", message, path, origin, cause);
    }
}
