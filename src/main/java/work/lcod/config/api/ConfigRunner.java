package work.lcod.config.api;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.config.error.ConfigBuildException;
import work.lcod.config.error.ParseException;
import work.lcod.config.eval.LazyEvaluator;
import work.lcod.config.include.IncludeLookup;
import work.lcod.config.include.IncludeResolver;
import work.lcod.config.include.SearchPathLookup;
import work.lcod.config.include.SourceRef;
import work.lcod.config.merge.MergeEngine;
import work.lcod.config.node.Node;
import work.lcod.config.node.NodePath;
import work.lcod.config.node.Origin;
import work.lcod.config.shared.Overrides;

/**
 * Public entry point for embedding: reads the sources of a {@link BuildConfiguration}, merges them in order
 * and evaluates the result. Every call is an independent build with its own include cache.
 */
public final class ConfigRunner {
    private static final Logger log = LoggerFactory.getLogger(ConfigRunner.class);

    private final MergeEngine mergeEngine = new MergeEngine();

    /**
     * Builds the concrete tree, throwing the {@link ConfigBuildException} that stopped the build.
     */
    public Node build(BuildConfiguration configuration) {
        Node merged = merge(configuration);
        var evaluator = new LazyEvaluator(configuration.dynamicProvider().orElse(null), configuration.workingDirectory());
        Node tree = evaluator.evaluate(merged);
        log.info("Built configuration from {} source(s) and {} override(s)",
            configuration.sources().size(), configuration.overrides().size());
        return tree;
    }

    /**
     * Merged tree before evaluation; deferred nodes are still in place.
     */
    public Node merge(BuildConfiguration configuration) {
        IncludeLookup lookup = configuration.includeLookup()
            .orElseGet(() -> new SearchPathLookup(configuration.searchPaths(), configuration.workingDirectory()));
        var resolver = new IncludeResolver(configuration.sourceProvider(), lookup, mergeEngine);

        var stages = new ArrayList<Node>();
        for (SourceRef source : configuration.sources()) {
            addStages(stages, resolver.load(source), source);
        }
        for (String override : configuration.overrides()) {
            SourceRef source = overrideSource(override);
            addStages(stages, resolver.load(source), source);
        }
        log.debug("Merging {} stage(s)", stages.size());
        return mergeEngine.merge(stages);
    }

    /**
     * Same as {@link #build(BuildConfiguration)} but reports failures in the result instead of throwing.
     */
    public BuildResult run(BuildConfiguration configuration) {
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("sources", configuration.sources().stream().map(SourceRef::name).toList());
        metadata.put("overrides", configuration.overrides());
        try {
            Node tree = build(configuration);
            metadata.put("status", "ok");
            return BuildResult.success(tree, metadata, started);
        } catch (ConfigBuildException ex) {
            log.warn("Configuration build failed: {}", ex.getMessage());
            log.debug("Build failure", ex);
            metadata.put("code", ex.code());
            if (ex.path() != null) {
                metadata.put("path", ex.path().toString());
            }
            if (ex.origin() != null) {
                metadata.put("origin", ex.origin().describe());
            }
            return BuildResult.failure(ex.getMessage(), metadata, started);
        } catch (RuntimeException ex) {
            log.warn("Configuration build failed unexpectedly", ex);
            metadata.put("code", "internal_error");
            return BuildResult.failure(String.valueOf(ex.getMessage()), metadata, started);
        }
    }

    private static SourceRef overrideSource(String override) {
        try {
            return SourceRef.inline(Overrides.toYaml(override), "<override " + override + ">");
        } catch (IllegalArgumentException ex) {
            throw new ParseException(ex.getMessage(), null, Origin.of("<override " + override + ">", null), ex);
        }
    }

    private static void addStages(List<Node> stages, List<Node> documents, SourceRef source) {
        for (Node document : documents) {
            stamp(document, NodePath.ROOT, source, stages.size());
            stages.add(document);
        }
    }

    private static void stamp(Node node, NodePath path, SourceRef source, int stage) {
        Origin origin = node.origin() != null ? node.origin() : Origin.of(source.name(), path);
        node.origin(origin.withStage(stage));
        if (node.isMapping()) {
            node.entries().forEach((key, child) -> stamp(child, path.child(key), source, stage));
        } else if (node.isSequence()) {
            for (int i = 0; i < node.size(); i++) {
                stamp(node.get(i), path.child(i), source, stage);
            }
        }
    }
}
