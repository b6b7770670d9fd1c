package work.lcod.config.error;

import work.lcod.config.node.NodePath;
import work.lcod.config.node.Origin;

public final class DynamicProviderException extends ConfigBuildException {
    public DynamicProviderException(String message, NodePath path, Origin origin) {
        super("dynamic_provider", message, path, origin);
    }

    public DynamicProviderException(String message, NodePath path, Origin origin, Throwable cause) {
        super("dynamic_provider", message, path, origin, cause);
    }
}
