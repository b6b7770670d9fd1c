package work.lcod.config.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.config.support.TreeFixtures.yaml;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.config.node.Node;
import work.lcod.config.node.NodePath;
import work.lcod.config.node.Priority;

class ConfigViewTest {
    private final ConfigView view = ConfigView.of(yaml("""
        model:
          name: m1
          classes: 100
          dropout: 0.5
          pretrained: true
          layers: [64, 32]
        keys: [a, b]
        """));

    @Test
    void typedAccessors() {
        ConfigView model = view.get("model");
        assertEquals("m1", model.get("name").asString());
        assertEquals(100L, model.get("classes").asLong());
        assertEquals(0.5d, model.get("dropout").asDouble());
        assertTrue(model.get("pretrained").asBoolean());
        assertEquals(List.of(64L, 32L), model.get("layers").asList());
        assertEquals(32L, model.get("layers").get(1).asLong());
    }

    @Test
    void keyNamedLikeAnAccessorIsStillJustAKey() {
        assertEquals(List.of("a", "b"), view.get("keys").asList());
        assertEquals(Set.of("model", "keys"), view.keys());
    }

    @Test
    void navigatesByPath() {
        assertEquals(64L, view.at("model.layers[0]").asLong());
        assertTrue(view.get("model").has("name"));
        assertFalse(view.get("model").has("missing"));
        assertEquals(5, view.get("model").size());
    }

    @Test
    void missingAndMistypedValuesFail() {
        assertThrows(NoSuchElementException.class, () -> view.get("nope"));
        assertThrows(NoSuchElementException.class, () -> view.at("model.layers[5]"));
        assertThrows(IllegalStateException.class, () -> view.get("model").asLong());
        assertThrows(IllegalStateException.class, () -> view.at("model.name").asMap());
    }

    @Test
    void exposesNodeAttributesSeparately() {
        Node tree = Node.emptyMapping()
            .put("lr", Node.scalar(0.1).priority(Priority.FORCED).metadata(Map.of("doc", "learning rate")));

        ConfigView.NodeInfo info = ConfigView.of(tree).get("lr").node();

        assertEquals(NodePath.parse("lr"), info.path());
        assertEquals(Priority.FORCED, info.priority());
        assertEquals("learning rate", info.metadata().get("doc"));
    }
}
