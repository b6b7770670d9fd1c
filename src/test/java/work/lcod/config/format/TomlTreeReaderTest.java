package work.lcod.config.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.config.error.ParseException;
import work.lcod.config.node.Node;

class TomlTreeReaderTest {
    private final TomlTreeReader reader = new TomlTreeReader();

    @Test
    void readsTablesAndArrays() {
        Node tree = reader.read("""
            title = "demo"

            [server]
            port = 8080
            hosts = ["a", "b"]
            ratio = 0.5
            """, "conf.toml").get(0);
        assertEquals("demo", tree.get("title").scalarValue());
        assertEquals(
            Map.of("port", 8080L, "hosts", List.of("a", "b"), "ratio", 0.5d),
            tree.get("server").toPlain()
        );
        assertTrue(tree.get("title").tag().isPlain());
    }

    @Test
    void malformedTomlIsAParseError() {
        var ex = assertThrows(ParseException.class, () -> reader.read("[server\nport = ", "bad.toml"));
        assertTrue(ex.getMessage().contains("bad.toml"), ex.getMessage());
    }
}
