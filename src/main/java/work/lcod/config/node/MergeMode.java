package work.lcod.config.node;

/**
 * How an incoming node combines with the node already present at its path.
 * A node without an explicit mode uses the default of its kind.
 */
public enum MergeMode {
    REPLACE,
    DEEP_MERGE,
    APPEND,
    DELETE;

    public static MergeMode defaultFor(Node.Kind kind) {
        return kind == Node.Kind.MAPPING ? DEEP_MERGE : REPLACE;
    }
}
