package work.lcod.config.api;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.config.node.Node;

/**
 * Outcome of a {@link ConfigRunner#run(BuildConfiguration)} call. {@code tree} is null on failure.
 */
public record BuildResult(Status status, Node tree, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    public BuildResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static BuildResult success(Node tree, Map<String, Object> metadata, Instant startedAt) {
        return new BuildResult(Status.SUCCESS, tree, metadata, startedAt, Instant.now());
    }

    public static BuildResult failure(String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new BuildResult(Status.FAILURE, null, meta, startedAt, Instant.now());
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public ConfigView view() {
        if (tree == null) {
            throw new IllegalStateException("Build failed: " + metadata.get("error"));
        }
        return ConfigView.of(tree);
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
