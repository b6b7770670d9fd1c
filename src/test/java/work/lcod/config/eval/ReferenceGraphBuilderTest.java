package work.lcod.config.eval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.config.support.TreeFixtures.yaml;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.config.error.DependencyCycleException;
import work.lcod.config.node.NodePath;

class ReferenceGraphBuilderTest {
    private final ReferenceGraphBuilder builder = new ReferenceGraphBuilder();

    @Test
    void collectsDeferredNodesInDocumentOrder() {
        ReferenceGraph graph = builder.build(yaml("""
            a: !ref b
            b: 1
            c: !fstr "{a}/{b}"
            """));
        assertEquals(
            List.of(NodePath.parse("a"), NodePath.parse("c")),
            graph.vertices().stream().map(ReferenceGraph.Vertex::path).toList()
        );
        assertEquals(List.of(NodePath.parse("a")), graph.vertex(NodePath.parse("c")).dependencies());
        assertEquals(2, graph.vertex(NodePath.parse("c")).reads().size());
    }

    @Test
    void ordersDependenciesFirst() {
        ReferenceGraph graph = builder.build(yaml("""
            c: !ref b
            b: !ref a
            a: !ref value
            value: 1
            """));
        assertEquals(
            List.of(NodePath.parse("a"), NodePath.parse("b"), NodePath.parse("c")),
            graph.evaluationOrder()
        );
    }

    @Test
    void nestedDeferredNodesAreOperands() {
        ReferenceGraph graph = builder.build(yaml("""
            fs:
              root: /x
              exp: !path [!ref fs.root, !ref model.name]
            model:
              name: m1
            """));
        ReferenceGraph.Vertex exp = graph.vertex(NodePath.parse("fs.exp"));
        assertEquals(List.of(NodePath.parse("fs.exp[0]"), NodePath.parse("fs.exp[1]")), exp.operands());
        assertEquals(exp.operands(), exp.dependencies());
    }

    @Test
    void readingAContainerWaitsForEverythingInside() {
        ReferenceGraph graph = builder.build(yaml("""
            copy: !ref source
            source:
              a: !ref x
              b: {c: !ref x}
            x: 1
            """));
        assertEquals(
            List.of(NodePath.parse("source.a"), NodePath.parse("source.b.c")),
            graph.vertex(NodePath.parse("copy")).dependencies()
        );
    }

    @Test
    void readingBelowADeferredNodeWaitsForThatNode() {
        ReferenceGraph graph = builder.build(yaml("""
            cfg: !ref base
            base: {lr: 1}
            lr: !ref cfg.lr
            """));
        ReferenceGraph.Vertex lr = graph.vertex(NodePath.parse("lr"));
        assertEquals(List.of(NodePath.parse("cfg")), lr.dependencies());
        assertEquals(NodePath.parse("cfg.lr"), lr.read("cfg.lr").resolved());
    }

    @Test
    void argumentsReadSiblingsThroughTheirEnclosingCall() {
        ReferenceGraph graph = builder.build(yaml("""
            model: !call:Model {layers: !ref depth, width: !fstr "w{.layers}"}
            depth: 3
            outside: !ref model.layers
            """));
        ReferenceGraph.Vertex width = graph.vertex(NodePath.parse("model.width"));
        assertEquals(NodePath.parse("model.layers"), width.read(".layers").resolved());
        assertEquals(List.of(NodePath.parse("model.layers")), width.dependencies());
        assertEquals(List.of(NodePath.parse("model")), graph.vertex(NodePath.parse("outside")).dependencies());
        assertEquals(
            List.of(
                NodePath.parse("model.layers"),
                NodePath.parse("model.width"),
                NodePath.parse("model"),
                NodePath.parse("outside")
            ),
            graph.evaluationOrder()
        );
    }

    @Test
    void missingTargetsAreRecordedNotThrown() {
        ReferenceGraph graph = builder.build(yaml("a: !ref nowhere\n"));
        ReferenceGraph.Read read = graph.vertex(NodePath.parse("a")).read("nowhere");
        assertFalse(read.isResolved());
        assertEquals(1, graph.unresolved().size());
        assertEquals(List.of(NodePath.parse("a")), graph.evaluationOrder());
    }

    @Test
    void relativeReadsResolveUpward() {
        ReferenceGraph graph = builder.build(yaml("""
            name: top
            model:
              label: !ref .name
            """));
        assertEquals(NodePath.parse("name"), graph.vertex(NodePath.parse("model.label")).read(".name").resolved());
    }

    @Test
    void cyclesAreReportedWithTheirParticipants() {
        ReferenceGraph graph = builder.build(yaml("a: !ref b\nb: !ref a\n"));
        var ex = assertThrows(DependencyCycleException.class, graph::evaluationOrder);
        assertEquals(List.of(NodePath.parse("a"), NodePath.parse("b")), ex.cycle());
        assertTrue(ex.getMessage().contains("'a' -> 'b' -> 'a'"), ex.getMessage());
    }
}
