package work.lcod.config.node;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NodeTest {
    @Test
    void convertsPlainValuesAndNormalisesNumbers() {
        Node node = Node.from(Map.of("count", 3, "ratio", 0.5f, "tags", List.of("a", "b")));
        assertTrue(node.isMapping());
        assertEquals(3L, node.get("count").scalarValue());
        assertEquals(0.5d, node.get("ratio").scalarValue());
        assertEquals(List.of("a", "b"), node.get("tags").toPlain());
    }

    @Test
    void attributesDoNotTouchTheValue() {
        Node node = Node.scalar("x")
            .priority(Priority.FORCED)
            .mergeMode(MergeMode.REPLACE)
            .metadata(Map.of("doc", "hint"));
        assertEquals("x", node.scalarValue());
        assertEquals(Priority.FORCED, node.priority());
        assertEquals(MergeMode.REPLACE, node.mergeMode());
        assertEquals("hint", node.metadata().get("doc"));
    }

    @Test
    void deepCopyIsIndependent() {
        Node original = Node.from(Map.of("a", Map.of("b", 1)));
        Node copy = original.deepCopy();
        copy.get("a").put("c", Node.scalar(2));
        assertNull(original.get("a").get("c"));
        assertNotSame(original.get("a"), copy.get("a"));
        assertEquals(Map.of("b", 1L), original.get("a").toPlain());
    }

    @Test
    void equalityIgnoresMetadataAndOrigin() {
        Node left = Node.scalar(1).metadata(Map.of("k", "v")).origin(Origin.of("a.yaml", NodePath.ROOT));
        Node right = Node.scalar(1).origin(Origin.of("b.yaml", NodePath.ROOT));
        assertEquals(left, right);
        assertEquals(left.hashCode(), right.hashCode());
        assertNotEquals(left, Node.scalar(1).priority(Priority.WEAK));
        assertNotEquals(Node.ref("a"), Node.scalar("a"));
    }

    @Test
    void mappingEqualityIgnoresKeyOrder() {
        var first = new LinkedHashMap<String, Object>();
        first.put("a", 1);
        first.put("b", 2);
        var second = new LinkedHashMap<String, Object>();
        second.put("b", 2);
        second.put("a", 1);
        assertEquals(Node.from(first), Node.from(second));
    }

    @Test
    void explicitModeEqualsKindDefault() {
        assertEquals(Node.emptyMapping(), Node.emptyMapping().mergeMode(MergeMode.DEEP_MERGE));
        assertNotEquals(Node.emptyMapping(), Node.emptyMapping().mergeMode(MergeMode.REPLACE));
    }

    @Test
    void plainViewSkipsDeleteMarkers() {
        Node node = Node.emptyMapping()
            .put("kept", Node.scalar(1))
            .put("gone", Node.deleteMarker());
        assertEquals(Map.of("kept", 1L), node.toPlain());
    }

    @Test
    void findsNodesByPath() {
        Node tree = Node.from(Map.of("a", Map.of("list", List.of("x", "y"))));
        assertEquals("y", tree.find(NodePath.parse("a.list[1]")).scalarValue());
        assertNull(tree.find(NodePath.parse("a.list[5]")));
        assertNull(tree.find(NodePath.parse("a.missing")));
        assertSame(tree, tree.find(NodePath.ROOT));
    }

    @Test
    void taggedConstructors() {
        assertTrue(Node.required().tag().isDeferred());
        assertEquals("model.name", Node.ref("model.name").scalarValue());
        assertTrue(Node.deleteMarker().isDeleteMarker());
        assertTrue(Priority.FORCED.hasPriorityOver(Priority.DEFAULT, false));
        assertTrue(Priority.WEAK.hasPriorityOver(Priority.WEAK, true));
    }
}
