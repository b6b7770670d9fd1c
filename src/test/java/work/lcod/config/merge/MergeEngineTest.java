package work.lcod.config.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.config.support.TreeFixtures.yaml;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.config.error.MergeTypeConflictException;
import work.lcod.config.node.MergeMode;
import work.lcod.config.node.Node;
import work.lcod.config.node.NodePath;
import work.lcod.config.node.PathReference;
import work.lcod.config.node.Priority;
import work.lcod.config.node.Tag;

class MergeEngineTest {
    private final MergeEngine engine = new MergeEngine();

    @Test
    void deepMergeUnionsKeys() {
        assertEquals(Map.of("a", 1L, "b", 2L), engine.merge(List.of(yaml("a: 1"), yaml("b: 2"))).toPlain());
        assertEquals(Map.of("a", 2L), engine.merge(List.of(yaml("a: 1"), yaml("a: 2"))).toPlain());
    }

    @Test
    void nestedMappingsMergeKeyByKey() {
        Node merged = engine.merge(List.of(
            yaml("model: {name: resnet, depth: 18}"),
            yaml("model: {depth: 50}\ndataset: {name: cifar100}")
        ));
        assertEquals(
            Map.of("model", Map.of("name", "resnet", "depth", 50L), "dataset", Map.of("name", "cifar100")),
            merged.toPlain()
        );
    }

    @Test
    void sequencesReplaceUnlessAppended() {
        assertEquals(Map.of("l", List.of(1L, 2L)), engine.merge(List.of(yaml("l: [0]"), yaml("l: [1, 2]"))).toPlain());
        assertEquals(
            Map.of("l", List.of(0L, 1L, 2L)),
            engine.merge(List.of(yaml("l: [0]"), yaml("l: !append [1, 2]"))).toPlain()
        );
    }

    @Test
    void appendOntoNothingKeepsTheItems() {
        Node merged = engine.merge(List.of(yaml("a: 1"), yaml("l: !append [1]")));
        assertEquals(Map.of("a", 1L, "l", List.of(1L)), merged.toPlain());
        assertEquals(MergeMode.APPEND, merged.get("l").mergeMode());
    }

    @Test
    void deleteRemovesTheKey() {
        Node merged = engine.merge(List.of(yaml("a: 1\nb: 2"), yaml("a: !del")));
        assertEquals(Map.of("b", 2L), merged.toPlain());
    }

    @Test
    void deleteLosesAgainstForcedValue() {
        Node merged = engine.merge(List.of(yaml("a: !force 1\nb: 2"), yaml("a: !del")));
        assertEquals(Map.of("a", 1L, "b", 2L), merged.toPlain());
    }

    @Test
    void forcedDescendantsSurviveDeleteOfTheirParent() {
        Node merged = engine.merge(List.of(yaml("a: {x: !force 1, y: 2}"), yaml("a: !del")));
        assertEquals(Map.of("a", Map.of("x", 1L)), merged.toPlain());
    }

    @Test
    void deleteWithContentReplacesTheMapping() {
        Node merged = engine.merge(List.of(yaml("a: {x: 1, y: 2}"), yaml("a: !del {z: 3}")));
        assertEquals(Map.of("a", Map.of("z", 3L)), merged.toPlain());
    }

    @Test
    void higherPriorityWinsInEitherOrder() {
        Node forcedFirst = engine.merge(List.of(yaml("x: !force 1"), yaml("x: 2")));
        Node forcedLast = engine.merge(List.of(yaml("x: 2"), yaml("x: !force 1")));
        assertEquals(1L, forcedFirst.get("x").scalarValue());
        assertEquals(1L, forcedLast.get("x").scalarValue());

        Node weakFirst = engine.merge(List.of(yaml("x: !weak 1"), yaml("x: 2")));
        Node weakLast = engine.merge(List.of(yaml("x: 2"), yaml("x: !weak 1")));
        assertEquals(2L, weakFirst.get("x").scalarValue());
        assertEquals(2L, weakLast.get("x").scalarValue());
    }

    @Test
    void forcedLeafInsideWeakContainerStillWins() {
        Node merged = engine.merge(List.of(yaml("cfg: !weak {a: !force 1, b: 2}"), yaml("cfg: {a: 3, b: 4}")));
        assertEquals(Map.of("cfg", Map.of("a", 1L, "b", 4L)), merged.toPlain());
    }

    @Test
    void mergeIsNotCommutative() {
        Node forward = engine.merge(List.of(yaml("x: !required"), yaml("x: 100")));
        Node reverse = engine.merge(List.of(yaml("x: 100"), yaml("x: !required")));
        assertEquals(100L, forward.get("x").scalarValue());
        assertTrue(reverse.get("x").tag().is(Tag.REQUIRED));
        assertNotEquals(forward, reverse);
    }

    @Test
    void requiredPlaceholderSurvivesMerge() {
        Node merged = engine.merge(List.of(yaml("model: {classes: !required}"), yaml("dataset: {name: x}")));
        assertTrue(merged.find(NodePath.parse("model.classes")).tag().is(Tag.REQUIRED));
    }

    @Test
    void groupingDoesNotChangeTheResult() {
        Node a = yaml("a: {x: 1, y: [1]}\nb: 1");
        Node b = yaml("""
            a:
              x: !del
              y: !append [2]
            c: !weak 3
            """);
        Node c = yaml("a: {z: 1}\nc: 4\nb: !replace {k: 1}");

        Object flat = engine.merge(List.of(a, b, c)).toPlain();
        Object left = engine.merge(List.of(engine.merge(List.of(a, b)), c)).toPlain();
        Object right = engine.merge(List.of(a, engine.merge(List.of(b, c)))).toPlain();

        assertEquals(Map.of("a", Map.of("y", List.of(1L, 2L), "z", 1L), "b", Map.of("k", 1L), "c", 4L), flat);
        assertEquals(flat, left);
        assertEquals(flat, right);
    }

    @Test
    void groupingDoesNotChangeTheResultWhenWeakStagesLose() {
        Object scalarBetweenMappings = sameForEveryGrouping(yaml("x: {a: 1}"), yaml("x: !weak 5"), yaml("x: {c: 3}"));
        assertEquals(Map.of("x", Map.of("a", 1L, "c", 3L)), scalarBetweenMappings);

        Node weakAppend = yaml("l: !append [1]");
        weakAppend.get("l").priority(Priority.WEAK);
        Object appends = sameForEveryGrouping(yaml("l: [0]"), weakAppend, yaml("l: !append [2]"));
        assertEquals(Map.of("l", List.of(0L, 2L)), appends);

        Node weakReplace = yaml("m: !replace {b: 2}");
        weakReplace.get("m").priority(Priority.WEAK);
        Object replaces = sameForEveryGrouping(yaml("m: {a: 1}"), weakReplace, yaml("m: {c: 3}"));
        assertEquals(Map.of("m", Map.of("a", 1L, "c", 3L)), replaces);
    }

    @Test
    void editedMergeResultMergesAsItIsNow() {
        Node merged = engine.merge(List.of(yaml("x: 1"), yaml("y: 2")));
        assertEquals(2, merged.mergeStages().size());

        merged.put("z", Node.scalar(3L));
        assertTrue(merged.mergeStages().isEmpty());
        assertEquals(Map.of("w", 0L, "x", 1L, "y", 2L, "z", 3L), engine.merge(List.of(yaml("w: 0"), merged)).toPlain());
    }

    @Test
    void prevMovesEarlierContentHere() {
        Node merged = engine.merge(List.of(
            yaml("old: {lr: 1, wd: 2}\nkeep: 1"),
            yaml("new: !prev old\nnested:\n  copy: !prev keep")
        ));
        assertEquals(Map.of("new", Map.of("lr", 1L, "wd", 2L), "nested", Map.of("copy", 1L)), merged.toPlain());
    }

    @Test
    void prevAndClearResolveWhateverTheGrouping() {
        Node a = yaml("old: {lr: 1}\nf: !call:pkg.fn {x: 1, y: 2}");
        Node b = yaml("new: !prev old\nf: !clear");
        Node c = yaml("new: {wd: 2}\nf: {z: 3}");

        Object merged = sameForEveryGrouping(a, b, c);

        assertEquals(Map.of("new", Map.of("lr", 1L, "wd", 2L), "f", Map.of("z", 3L)), merged);
        assertEquals(Tag.dynamic("call", "pkg.fn"), engine.merge(List.of(a, b, c)).get("f").tag());
    }

    @Test
    void prevWithNothingEarlierStaysInTheTree() {
        Node merged = engine.merge(List.of(yaml("x: 1"), yaml("new: !prev old")));
        assertEquals(Tag.prev(), merged.get("new").tag());
        assertEquals(1L, merged.get("x").scalarValue());
    }

    @Test
    void clearOfAScalarIsAConflict() {
        assertThrows(MergeTypeConflictException.class, () -> engine.merge(List.of(yaml("x: 1"), yaml("x: !clear"))));
    }

    private Object sameForEveryGrouping(Node a, Node b, Node c) {
        Object flat = engine.merge(List.of(a, b, c)).toPlain();
        assertEquals(flat, engine.merge(List.of(engine.merge(List.of(a, b)), c)).toPlain());
        assertEquals(flat, engine.merge(List.of(a, engine.merge(List.of(b, c)))).toPlain());
        assertEquals(flat, engine.merge(a, engine.merge(b, c)).toPlain());
        return flat;
    }

    @Test
    void inputsAreLeftUntouched() {
        Node base = yaml("a: {x: 1}\nl: [1]");
        Node incoming = yaml("""
            a:
              x: !del
              y: 2
            l: !append [2]
            """);
        Node baseCopy = base.deepCopy();
        Node incomingCopy = incoming.deepCopy();

        engine.merge(List.of(base, incoming));

        assertEquals(baseCopy, base);
        assertEquals(incomingCopy, incoming);
    }

    @Test
    void taggedMappingKeepsItsTagWhenPlainMappingMergesIn() {
        Node merged = engine.merge(List.of(yaml("f: !call:pkg.fn {x: 1}"), yaml("f: {y: 2}")));
        Node f = merged.get("f");
        assertEquals(Tag.dynamic("call", "pkg.fn"), f.tag());
        assertEquals(Map.of("x", 1L, "y", 2L), f.toPlain());
    }

    @Test
    void explicitMergeUpdatesSequenceIndices() {
        Node merged = engine.merge(List.of(yaml("l: [a, b]"), yaml("l: !merge {1: c}")));
        assertEquals(Map.of("l", List.of("a", "c")), merged.toPlain());

        assertThrows(MergeTypeConflictException.class,
            () -> engine.merge(List.of(yaml("l: [a, b]"), yaml("l: !merge {name: c}"))));
    }

    @Test
    void appendOfAMappingIsAConflict() {
        Node incoming = Node.emptyMapping().put("a", Node.emptyMapping().mergeMode(MergeMode.APPEND));
        assertThrows(MergeTypeConflictException.class, () -> engine.merge(List.of(yaml("a: {x: 1}"), incoming)));
    }

    @Test
    void metadataFromBothSidesIsKept() {
        Node base = Node.from(Map.of("a", 1)).metadata(Map.of("owner", "base", "doc", "first"));
        Node incoming = Node.from(Map.of("b", 2)).metadata(Map.of("doc", "second"));
        Node merged = engine.merge(base, incoming);
        assertEquals(Map.of("owner", "base", "doc", "second"), merged.metadata());
    }

    @Test
    void relocatesNodesAfterTheMerge() {
        Node moved = engine.merge(List.of(yaml("a: {x: 1}"), yaml("a: {x: !move:b 2}")));
        assertEquals(Map.of("a", Map.of(), "b", 2L), moved.toPlain());

        Node relative = engine.merge(List.of(yaml("a: {x: !move:.y 1}")));
        assertEquals(Map.of("a", Map.of("y", 1L)), relative.toPlain());

        Node nested = engine.merge(List.of(yaml("a: {x: !move:deep.inside.x 1}")));
        assertEquals(Map.of("a", Map.of(), "deep", Map.of("inside", Map.of("x", 1L))), nested.toPlain());
    }

    @Test
    void collidingRelocationsUsePriority() {
        Node tree = Node.emptyMapping()
            .put("p", Node.scalar(1).priority(Priority.FORCED).relocation(PathReference.parse("t")))
            .put("q", Node.scalar(2).relocation(PathReference.parse("t")));
        Node merged = engine.merge(List.of(tree));
        assertEquals(Map.of("t", 1L), merged.toPlain());

        Node reversed = Node.emptyMapping()
            .put("p", Node.scalar(1).relocation(PathReference.parse("t")))
            .put("q", Node.scalar(2).relocation(PathReference.parse("t")));
        assertEquals(Map.of("t", 2L), engine.merge(List.of(reversed)).toPlain());
    }

    @Test
    void relocatingThroughAScalarIsAConflict() {
        assertThrows(MergeTypeConflictException.class,
            () -> engine.merge(List.of(yaml("s: 1\na: !move:s.x 2"))));
    }

    @Test
    void emptyInputGivesEmptyMapping() {
        assertEquals(Map.of(), engine.merge(List.of()).toPlain());
    }
}
