package work.lcod.config.support;

import java.util.List;
import work.lcod.config.format.YamlTreeReader;
import work.lcod.config.node.Node;

/**
 * Shared helpers for building trees from YAML snippets in tests.
 */
public final class TreeFixtures {
    private static final YamlTreeReader YAML = new YamlTreeReader();

    private TreeFixtures() {}

    /**
     * First document of {@code text}, or an empty mapping when there is none.
     */
    public static Node yaml(String text) {
        List<Node> documents = YAML.read(text, "<test>");
        return documents.isEmpty() ? Node.emptyMapping() : documents.get(0);
    }

    public static List<Node> documents(String text) {
        return YAML.read(text, "<test>");
    }
}
