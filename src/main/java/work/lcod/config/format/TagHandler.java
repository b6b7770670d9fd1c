package work.lcod.config.format;

import work.lcod.config.node.Node;
import work.lcod.config.node.NodePath;
import work.lcod.config.node.Origin;

/**
 * Turns the raw node read under a tag into its tagged form.
 * {@code argument} is the part of the tag after {@code :}, or null.
 */
@FunctionalInterface
public interface TagHandler {
    Node apply(Node value, String argument, NodePath path, Origin origin);
}
