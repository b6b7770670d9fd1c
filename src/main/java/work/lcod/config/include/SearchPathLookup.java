package work.lcod.config.include;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Default lookup: absolute targets as given, relative ones against the including file's directory,
 * then each search path, then the working directory.
 */
public final class SearchPathLookup implements IncludeLookup {
    private final List<Path> searchPaths;
    private final Path workingDirectory;

    public SearchPathLookup(List<Path> searchPaths, Path workingDirectory) {
        this.searchPaths = List.copyOf(searchPaths);
        this.workingDirectory = workingDirectory;
    }

    @Override
    public Optional<SourceRef> locate(String target, SourceRef requester) {
        Path raw = Path.of(target);
        if (raw.isAbsolute()) {
            return Files.isRegularFile(raw) ? Optional.of(SourceRef.file(raw)) : Optional.empty();
        }
        for (Path directory : lookupDirectories(requester)) {
            Path candidate = directory.resolve(raw);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(SourceRef.file(candidate));
            }
        }
        return Optional.empty();
    }

    private List<Path> lookupDirectories(SourceRef requester) {
        var directories = new ArrayList<Path>();
        if (requester != null && requester.directory() != null) {
            directories.add(requester.directory());
        }
        directories.addAll(searchPaths);
        if (workingDirectory != null) {
            directories.add(workingDirectory);
        }
        return directories;
    }
}
