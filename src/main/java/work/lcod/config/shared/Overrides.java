package work.lcod.config.shared;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import work.lcod.config.node.NodePath;

/**
 * Turns command-line overrides such as {@code model.classes=100} into YAML text that merges the value
 * at that path. The value is YAML itself, so tags like {@code !del} or {@code !force 1} work.
 */
public final class Overrides {
    private static final ObjectMapper JSON = new ObjectMapper();

    private Overrides() {}

    public static boolean isOverride(String argument) {
        if (argument == null) {
            return false;
        }
        int equals = argument.indexOf('=');
        if (equals <= 0) {
            return false;
        }
        String key = argument.substring(0, equals).trim();
        return !key.isEmpty() && !key.startsWith("{") && !key.contains("/") && !key.contains("\\") && !key.contains(" ");
    }

    public static String toYaml(String override) {
        int equals = override.indexOf('=');
        if (equals <= 0) {
            throw new IllegalArgumentException("Override must look like path.to.key=value: " + override);
        }
        NodePath path = NodePath.parse(override.substring(0, equals).trim());
        if (path.isRoot()) {
            throw new IllegalArgumentException("Override needs a key: " + override);
        }
        String value = override.substring(equals + 1).trim();
        var yaml = new StringBuilder();
        for (int depth = 0; depth < path.size(); depth++) {
            Object segment = path.segment(depth);
            if (!(segment instanceof String key)) {
                throw new IllegalArgumentException("Override paths cannot index sequences: " + override);
            }
            yaml.append("  ".repeat(depth)).append(quote(key)).append(':');
            if (depth == path.size() - 1 && !value.isEmpty()) {
                yaml.append(' ').append(value);
            }
            yaml.append('\n');
        }
        return yaml.toString();
    }

    private static String quote(String key) {
        try {
            return JSON.writeValueAsString(key);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Cannot quote key " + key, ex);
        }
    }
}
