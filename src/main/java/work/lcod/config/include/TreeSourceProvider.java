package work.lcod.config.include;

import java.util.List;
import work.lcod.config.node.Node;

/**
 * Turns a source into trees. A source holding several documents yields one tree per document, in order.
 * Implementations report malformed input with {@link work.lcod.config.error.ParseException}.
 */
@FunctionalInterface
public interface TreeSourceProvider {
    List<Node> read(SourceRef source);
}
