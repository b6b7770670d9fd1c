package work.lcod.config.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.config.error.MissingRequiredValueException;
import work.lcod.config.error.ParseException;
import work.lcod.config.node.Node;
import work.lcod.config.node.NodePath;

class ConfigRunnerTest {
    @TempDir
    Path dir;

    private final ConfigRunner runner = new ConfigRunner();

    private Path write(String name, String text) throws IOException {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, text);
        return file;
    }

    @Test
    void buildsFilesInOrder() throws IOException {
        write("conf/model.yaml", "classes: !required\nlayers: [64, 64]\n");
        Path base = write("base.yaml", "model: !include conf/model.yaml\ndataset:\n  name: !required\n");
        Path experiment = write("cifar.toml", "[model]\nclasses = 100\n\n[dataset]\nname = \"cifar100\"\n");

        Node tree = runner.build(BuildConfiguration.builder()
            .workingDirectory(dir)
            .file(base)
            .file(experiment)
            .build());

        assertEquals(
            Map.of(
                "model", Map.of("classes", 100L, "layers", List.of(64L, 64L)),
                "dataset", Map.of("name", "cifar100")
            ),
            tree.toPlain()
        );
    }

    @Test
    void overridesApplyLast() throws IOException {
        Path base = write("base.yaml", "train:\n  lr: 0.1\n  epochs: 10\n  tag: !fstr \"lr{train.lr}\"\n");

        Node tree = runner.build(BuildConfiguration.builder()
            .workingDirectory(dir)
            .file(base)
            .inline("train: {epochs: 20}")
            .override("train.lr=0.5")
            .override("train.epochs=!del")
            .build());

        assertEquals(Map.of("lr", 0.5d, "tag", "lr0.5"), tree.get("train").toPlain());
    }

    @Test
    void nodesRememberTheirStage() throws IOException {
        Path base = write("base.yaml", "a: 1\nb: 2\n");

        Node tree = runner.build(BuildConfiguration.builder()
            .workingDirectory(dir)
            .file(base)
            .override("b=3")
            .build());

        assertEquals(0, tree.get("a").origin().stage());
        assertEquals(1, tree.get("b").origin().stage());
        assertEquals("<override b=3>", tree.get("b").origin().source());
    }

    @Test
    void mergeLeavesDeferredNodesInPlace() {
        Node merged = runner.merge(BuildConfiguration.builder().inline("a: 1\nb: !ref a\n").build());
        assertTrue(merged.get("b").tag().isDeferred());
    }

    @Test
    void buildThrowsTheFirstError() {
        var configuration = BuildConfiguration.builder().inline("a: !required\n").build();
        assertThrows(MissingRequiredValueException.class, () -> runner.build(configuration));
        assertThrows(
            ParseException.class,
            () -> runner.build(BuildConfiguration.builder().override("items[0]=1").build())
        );
    }

    @Test
    void runReportsFailuresInMetadata() {
        BuildResult result = runner.run(BuildConfiguration.builder().inline("model:\n  classes: !required\n").build());

        assertFalse(result.isSuccess());
        assertEquals(1, result.status().exitCode());
        assertNull(result.tree());
        assertEquals("missing_required", result.metadata().get("code"));
        assertEquals("model.classes", result.metadata().get("path"));
        assertTrue(String.valueOf(result.metadata().get("error")).contains("model.classes"));
        assertThrows(IllegalStateException.class, result::view);
    }

    @Test
    void runReturnsTreeOnSuccess() {
        BuildResult result = runner.run(BuildConfiguration.builder()
            .inline("a: 1")
            .override("b=two")
            .build());

        assertTrue(result.isSuccess());
        assertEquals("ok", result.metadata().get("status"));
        assertEquals(List.of("b=two"), result.metadata().get("overrides"));
        assertEquals("two", result.view().get("b").asString());
        assertFalse(result.finishedAt().isBefore(result.startedAt()));
    }

    @Test
    void dynamicExpressionsUseTheConfiguredProvider() {
        Node tree = runner.build(BuildConfiguration.builder()
            .inline("size: !double 21\n")
            .dynamicProvider((expression, dependencies) -> ((Number) expression.payload()).longValue() * 2)
            .build());
        assertEquals(42L, tree.find(NodePath.parse("size")).scalarValue());
    }
}
