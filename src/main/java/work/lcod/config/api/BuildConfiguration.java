package work.lcod.config.api;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.config.eval.DynamicProvider;
import work.lcod.config.format.DefaultTreeSourceProvider;
import work.lcod.config.include.IncludeLookup;
import work.lcod.config.include.SourceRef;
import work.lcod.config.include.TreeSourceProvider;

/**
 * Immutable description of one build: the ordered sources, the overrides merged after them and the
 * collaborators used to read, include and evaluate.
 */
public record BuildConfiguration(
    List<SourceRef> sources,
    List<String> overrides,
    List<Path> searchPaths,
    Path workingDirectory,
    TreeSourceProvider sourceProvider,
    Optional<IncludeLookup> includeLookup,
    Optional<DynamicProvider> dynamicProvider,
    LogLevel logLevel
) {
    public BuildConfiguration {
        sources = List.copyOf(Objects.requireNonNull(sources, "sources"));
        overrides = List.copyOf(Objects.requireNonNull(overrides, "overrides"));
        searchPaths = List.copyOf(Objects.requireNonNull(searchPaths, "searchPaths"));
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(sourceProvider, "sourceProvider");
        Objects.requireNonNull(includeLookup, "includeLookup");
        Objects.requireNonNull(dynamicProvider, "dynamicProvider");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<SourceRef> sources = new ArrayList<>();
        private final List<String> overrides = new ArrayList<>();
        private final List<Path> searchPaths = new ArrayList<>();
        private Path workingDirectory = Path.of("").toAbsolutePath();
        private TreeSourceProvider sourceProvider = new DefaultTreeSourceProvider();
        private IncludeLookup includeLookup;
        private DynamicProvider dynamicProvider;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder source(SourceRef source) {
            sources.add(Objects.requireNonNull(source, "source"));
            return this;
        }

        public Builder file(Path file) {
            return source(SourceRef.file(file));
        }

        public Builder inline(String text) {
            return source(SourceRef.inline(text, "<inline " + (sources.size() + 1) + ">"));
        }

        public Builder override(String override) {
            overrides.add(Objects.requireNonNull(override, "override"));
            return this;
        }

        public Builder searchPath(Path directory) {
            searchPaths.add(Objects.requireNonNull(directory, "directory"));
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder sourceProvider(TreeSourceProvider sourceProvider) {
            this.sourceProvider = sourceProvider;
            return this;
        }

        /**
         * Replaces the default search-path lookup.
         */
        public Builder includeLookup(IncludeLookup includeLookup) {
            this.includeLookup = includeLookup;
            return this;
        }

        public Builder dynamicProvider(DynamicProvider dynamicProvider) {
            this.dynamicProvider = dynamicProvider;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public BuildConfiguration build() {
            return new BuildConfiguration(
                sources,
                overrides,
                searchPaths,
                workingDirectory,
                sourceProvider,
                Optional.ofNullable(includeLookup),
                Optional.ofNullable(dynamicProvider),
                logLevel
            );
        }
    }
}
