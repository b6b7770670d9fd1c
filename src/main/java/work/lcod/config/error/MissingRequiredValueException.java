package work.lcod.config.error;

import java.util.List;
import java.util.stream.Collectors;
import work.lcod.config.node.NodePath;
import work.lcod.config.node.Origin;

/**
 * One or more {@code !required} placeholders were never overwritten.
 */
public final class MissingRequiredValueException extends ConfigBuildException {
    private final List<NodePath> paths;

    public MissingRequiredValueException(List<NodePath> paths, Origin origin) {
        super("missing_required", describe(paths), paths.get(0), origin);
        this.paths = List.copyOf(paths);
    }

    private static String describe(List<NodePath> paths) {
        String joined = paths.stream().map(path -> "'" + path + "'").collect(Collectors.joining(", "));
        return paths.size() == 1
            ? "Required value " + joined + " was never provided"
            : "Required values were never provided: " + joined;
    }

    public List<NodePath> paths() {
        return paths;
    }
}
