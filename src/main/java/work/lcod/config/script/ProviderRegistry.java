package work.lcod.config.script;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import work.lcod.config.error.DynamicProviderException;
import work.lcod.config.eval.DynamicExpression;
import work.lcod.config.eval.DynamicProvider;
import work.lcod.config.node.NodePath;

/**
 * Routes dynamic expressions to the provider registered for their tag name.
 */
public final class ProviderRegistry implements DynamicProvider {
    private final Map<String, DynamicProvider> providers = new ConcurrentHashMap<>();

    /**
     * Registry with the JavaScript provider bound to {@code !eval}.
     */
    public static ProviderRegistry withScripts() {
        return new ProviderRegistry().register(ScriptDynamicProvider.TAG, new ScriptDynamicProvider());
    }

    public ProviderRegistry register(String tag, DynamicProvider provider) {
        providers.put(tag, provider);
        return this;
    }

    public DynamicProvider get(String tag) {
        return providers.get(tag);
    }

    public void unregister(String tag) {
        if (tag != null) {
            providers.remove(tag);
        }
    }

    public Map<String, DynamicProvider> entries() {
        return Collections.unmodifiableMap(providers);
    }

    @Override
    public Object evaluate(DynamicExpression expression, Map<NodePath, Object> dependencies) throws Exception {
        DynamicProvider provider = providers.get(expression.tag());
        if (provider == null) {
            throw new DynamicProviderException(
                "No provider registered for !" + expression.tag(),
                expression.path(),
                expression.origin()
            );
        }
        return provider.evaluate(expression, dependencies);
    }
}
