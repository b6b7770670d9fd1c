package work.lcod.config.script;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static work.lcod.config.support.TreeFixtures.yaml;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import work.lcod.config.error.DynamicProviderException;
import work.lcod.config.eval.DynamicExpression;
import work.lcod.config.eval.LazyEvaluator;
import work.lcod.config.node.Node;
import work.lcod.config.node.NodePath;

class ScriptDynamicProviderTest {
    private final ScriptDynamicProvider provider = new ScriptDynamicProvider();

    @BeforeAll
    static void requireEngine() {
        assumeTrue(ScriptDynamicProvider.isAvailable(), "GraalJS is not available");
    }

    private Object run(Object payload) throws Exception {
        return provider.evaluate(new DynamicExpression("eval", null, payload, NodePath.parse("v"), null), Map.of());
    }

    @Test
    void convertsScriptResults() throws Exception {
        assertEquals(6L, run("1 + 2 + 3"));
        assertEquals(0.5d, run("1 / 2"));
        assertEquals("ab", run("'a' + 'b'"));
        assertEquals(List.of(1L, true), run("[1, true]"));
        assertEquals(Map.of("x", "y"), run("({x: 'y'})"));
    }

    @Test
    void bindsWithEntriesAsGlobals() throws Exception {
        Object result = run(Map.of("code", "sizes.map(s => s * scale)", "with", Map.of("sizes", List.of(1, 2), "scale", 3)));
        assertEquals(List.of(3L, 6L), result);
    }

    @Test
    void awaitsPromises() throws Exception {
        assertEquals(4L, run("Promise.resolve(4)"));
    }

    @Test
    void rejectsPayloadsWithoutCode() {
        assertThrows(IllegalArgumentException.class, () -> run(Map.of("with", Map.of())));
        assertThrows(IllegalArgumentException.class, () -> run(" "));
    }

    @Test
    void evaluatesInsideATree() {
        Node result = new LazyEvaluator(ProviderRegistry.withScripts()).evaluate(yaml("""
            base: 5
            total: !eval
              code: a + b
              with:
                a: !ref base
                b: 2
            """));
        assertEquals(7L, result.get("total").scalarValue());
    }

    @Test
    void scriptErrorsBecomeProviderErrors() {
        var evaluator = new LazyEvaluator(ProviderRegistry.withScripts());
        var ex = assertThrows(DynamicProviderException.class, () -> evaluator.evaluate(yaml("v: !eval \"throw new Error('boom')\"\n")));
        assertEquals(NodePath.parse("v"), ex.path());
    }
}
