package work.lcod.config.eval;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.lcod.config.error.EvaluationException;
import work.lcod.config.node.NodePath;
import work.lcod.config.node.Origin;

/**
 * {@code !path[:point]} nodes: joins segments onto a reference point and normalises the result.
 * Reference points: none (relative to {@code .}), {@code cwd}, {@code file}, {@code parent}, {@code parent(n)}
 * and {@code abs(p)}. {@code parent} is the directory of the declaring file, {@code parent(n)} goes n levels above it.
 */
final class PathJoin {
    private static final Pattern PARENT = Pattern.compile("parent(?:\\((\\d+)\\))?");
    private static final Pattern ABSOLUTE = Pattern.compile("abs\\((.*)\\)");

    private PathJoin() {}

    static String join(String referencePoint, List<Object> segments, NodePath path, Origin origin, Path workingDirectory) {
        Path result = base(referencePoint, path, origin, workingDirectory);
        try {
            for (int i = 0; i < segments.size(); i++) {
                Object segment = segments.get(i);
                if (!(segment instanceof String) && !(segment instanceof Number)) {
                    throw new EvaluationException(
                        "Path segment " + i + " is not path-like: " + Interpolation.stringify(segment),
                        path,
                        origin
                    );
                }
                result = result.resolve(String.valueOf(segment));
            }
        } catch (InvalidPathException ex) {
            throw new EvaluationException("Invalid path segment: " + ex.getMessage(), path, origin, ex);
        }
        String normalized = result.normalize().toString();
        return normalized.isEmpty() ? "." : normalized;
    }

    private static Path base(String referencePoint, NodePath path, Origin origin, Path workingDirectory) {
        if (referencePoint == null || referencePoint.isBlank()) {
            return Path.of(".");
        }
        if (referencePoint.equals("cwd")) {
            return workingDirectory;
        }
        if (referencePoint.equals("file")) {
            return sourceFile(referencePoint, path, origin);
        }
        Matcher parent = PARENT.matcher(referencePoint);
        if (parent.matches()) {
            int levels;
            try {
                levels = parent.group(1) == null ? 0 : Integer.parseInt(parent.group(1));
            } catch (NumberFormatException ex) {
                throw new EvaluationException("Parent level out of range in '" + referencePoint + "'", path, origin, ex);
            }
            Path directory = sourceFile(referencePoint, path, origin).getParent();
            for (int i = 0; i < levels && directory.getParent() != null; i++) {
                directory = directory.getParent();
            }
            return directory;
        }
        Matcher absolute = ABSOLUTE.matcher(referencePoint);
        if (absolute.matches()) {
            return Path.of(absolute.group(1));
        }
        throw new EvaluationException("Unknown path reference point '" + referencePoint + "'", path, origin);
    }

    private static Path sourceFile(String referencePoint, NodePath path, Origin origin) {
        if (origin == null || origin.source() == null || origin.source().startsWith("<")) {
            throw new EvaluationException(
                "Reference point '" + referencePoint + "' needs a node read from a file",
                path,
                origin
            );
        }
        return Path.of(origin.source()).toAbsolutePath();
    }
}
