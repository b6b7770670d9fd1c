package work.lcod.config.eval;

import java.util.Map;
import work.lcod.config.node.NodePath;

/**
 * Computes dynamic expressions ({@code !eval}, {@code !call} and any tag without a built-in meaning).
 * {@code dependencies} holds the resolved value of every deferred node nested in the expression, by path.
 * Failures are reported to the caller as {@link work.lcod.config.error.DynamicProviderException}.
 */
@FunctionalInterface
public interface DynamicProvider {
    Object evaluate(DynamicExpression expression, Map<NodePath, Object> dependencies) throws Exception;
}
