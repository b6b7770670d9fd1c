package work.lcod.config.format;

import java.util.List;
import java.util.Locale;
import work.lcod.config.include.SourceRef;
import work.lcod.config.include.TreeSourceProvider;
import work.lcod.config.node.Node;

/**
 * Reads {@code .toml} files with {@link TomlTreeReader} and every other source as YAML.
 */
public final class DefaultTreeSourceProvider implements TreeSourceProvider {
    private final YamlTreeReader yaml;
    private final TomlTreeReader toml = new TomlTreeReader();

    public DefaultTreeSourceProvider() {
        this(new YamlTreeReader());
    }

    public DefaultTreeSourceProvider(YamlTreeReader yaml) {
        this.yaml = yaml;
    }

    @Override
    public List<Node> read(SourceRef source) {
        if (!source.isFile()) {
            return yaml.read(source.text(), source.name());
        }
        String fileName = source.path().getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".toml") ? toml.read(source.path()) : yaml.read(source.path());
    }
}
