package work.lcod.config.eval;

import work.lcod.config.node.NodePath;
import work.lcod.config.node.Origin;

/**
 * A node the evaluator cannot compute itself, handed to a {@link DynamicProvider}.
 *
 * @param tag tag name, e.g. {@code eval} or {@code call}
 * @param argument text after {@code :} in the tag, or null
 * @param payload plain value of the node, with nested references already resolved
 * @param path location of the node in the tree
 * @param origin provenance of the node, may be null
 */
public record DynamicExpression(String tag, String argument, Object payload, NodePath path, Origin origin) {}
