package work.lcod.config.node;

/**
 * Where a node came from. Only used for diagnostics.
 *
 * @param source file path or display name of the source
 * @param path path of the node inside that source
 * @param stage index of the merge stage the node entered the build with, -1 when unknown
 */
public record Origin(String source, NodePath path, int stage) {
    public static Origin of(String source, NodePath path) {
        return new Origin(source, path, -1);
    }

    public Origin withStage(int newStage) {
        return new Origin(source, path, newStage);
    }

    public String describe() {
        var builder = new StringBuilder(source == null ? "<unknown>" : source);
        if (path != null && !path.isRoot()) {
            builder.append(" at ").append(path);
        }
        if (stage >= 0) {
            builder.append(" (stage ").append(stage).append(')');
        }
        return builder.toString();
    }
}
