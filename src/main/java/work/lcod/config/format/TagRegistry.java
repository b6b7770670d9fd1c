package work.lcod.config.format;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import work.lcod.config.error.ParseException;
import work.lcod.config.node.MergeMode;
import work.lcod.config.node.Node;
import work.lcod.config.node.NodePath;
import work.lcod.config.node.Origin;
import work.lcod.config.node.PathReference;
import work.lcod.config.node.Priority;
import work.lcod.config.node.Tag;

/**
 * Tag vocabulary of the source format. Tags without a registered handler are kept as dynamic expressions,
 * so new tags reach a {@link work.lcod.config.eval.DynamicProvider} without any change here.
 */
public final class TagRegistry {
    private final Map<String, TagHandler> handlers = new ConcurrentHashMap<>();

    public static TagRegistry standard() {
        var registry = new TagRegistry();
        registry.register("weak", (value, argument, path, origin) -> plain(value).priority(Priority.WEAK));
        registry.register("force", (value, argument, path, origin) -> plain(value).priority(Priority.FORCED));
        registry.register("del", TagRegistry::delete);
        registry.register("replace", (value, argument, path, origin) -> plain(value).mergeMode(MergeMode.REPLACE));
        registry.register("merge", (value, argument, path, origin) -> plain(value).mergeMode(MergeMode.DEEP_MERGE));
        registry.register("append", TagRegistry::append);
        registry.register("extend", TagRegistry::append);
        registry.register("move", TagRegistry::move);
        registry.register(Tag.PREV, TagRegistry::previous);
        registry.register(Tag.CLEAR, TagRegistry::clear);
        registry.register("null", (value, argument, path, origin) -> Node.scalar(null));
        registry.register(Tag.REQUIRED, TagRegistry::required);
        registry.register(Tag.REF, TagRegistry::reference);
        registry.register("xref", TagRegistry::reference);
        registry.register(Tag.PATH, TagRegistry::pathJoin);
        registry.register(Tag.FSTR, TagRegistry::interpolation);
        registry.register(Tag.INCLUDE, (value, argument, path, origin) -> value.tag(Tag.include()));
        return registry;
    }

    public TagRegistry register(String name, TagHandler handler) {
        handlers.put(name, handler);
        return this;
    }

    public TagHandler get(String name) {
        return handlers.get(name);
    }

    public Map<String, TagHandler> entries() {
        return Collections.unmodifiableMap(handlers);
    }

    /**
     * Applies the tag {@code typeId} (as written, without the leading {@code !}) to {@code value}.
     */
    public Node apply(String typeId, Node value, NodePath path, Origin origin) {
        int colon = typeId.indexOf(':');
        String name = colon < 0 ? typeId : typeId.substring(0, colon);
        String argument = colon < 0 ? null : typeId.substring(colon + 1);
        TagHandler handler = handlers.get(name);
        Node tagged = handler != null
            ? handler.apply(value, argument, path, origin)
            : value.tag(Tag.dynamic(name, argument));
        if (tagged.origin() == null) {
            tagged.origin(origin);
        }
        return tagged;
    }

    private static Node plain(Node value) {
        if (value.isScalar() && value.scalarValue() instanceof String text) {
            return Node.scalar(PlainScalars.resolve(text)).copyAttributesFrom(value);
        }
        return value;
    }

    private static boolean isEmpty(Node value) {
        return value.isScalar() && (value.scalarValue() == null || "".equals(value.scalarValue()));
    }

    private static Node delete(Node value, String argument, NodePath path, Origin origin) {
        if (isEmpty(value)) {
            return Node.deleteMarker().origin(origin);
        }
        return plain(value).mergeMode(MergeMode.REPLACE);
    }

    private static Node append(Node value, String argument, NodePath path, Origin origin) {
        if (value.isSequence()) {
            return value.mergeMode(MergeMode.APPEND);
        }
        if (value.isMapping()) {
            throw new ParseException("!append expects a sequence or a scalar", path, origin);
        }
        Node sequence = isEmpty(value) ? Node.emptySequence() : Node.sequence(List.of(plain(value)));
        return sequence.origin(origin).mergeMode(MergeMode.APPEND);
    }

    private static Node move(Node value, String argument, NodePath path, Origin origin) {
        if (argument == null) {
            throw new ParseException("!move needs a target, as in !move:new.location", path, origin);
        }
        return plain(value).relocation(parseReference(argument, "!move", path, origin));
    }

    private static Node previous(Node value, String argument, NodePath path, Origin origin) {
        if (!(value.scalarValue() instanceof String source) || source.isBlank()) {
            throw new ParseException("!prev expects the path of a node from an earlier source", path, origin);
        }
        NodePath parsed;
        try {
            parsed = NodePath.parse(source.trim());
        } catch (IllegalArgumentException ex) {
            throw new ParseException("Invalid !prev path '" + source + "': " + ex.getMessage(), path, origin, ex);
        }
        if (parsed.isRoot()) {
            throw new ParseException("!prev cannot take the whole tree", path, origin);
        }
        return Node.scalar(source.trim()).tag(Tag.prev()).origin(origin);
    }

    private static Node clear(Node value, String argument, NodePath path, Origin origin) {
        if (!isEmpty(value)) {
            throw new ParseException("!clear does not take a value", path, origin);
        }
        return Node.scalar(null).tag(Tag.clear()).origin(origin);
    }

    private static Node required(Node value, String argument, NodePath path, Origin origin) {
        if (!isEmpty(value)) {
            throw new ParseException("!required does not take a value", path, origin);
        }
        return Node.required().origin(origin);
    }

    private static Node reference(Node value, String argument, NodePath path, Origin origin) {
        if (!(value.scalarValue() instanceof String target) || target.isBlank()) {
            throw new ParseException("!ref expects the path of the referenced node", path, origin);
        }
        parseReference(target, "!ref", path, origin);
        return Node.ref(target.trim()).origin(origin);
    }

    private static Node pathJoin(Node value, String argument, NodePath path, Origin origin) {
        Tag tag = Tag.path(argument);
        if (value.isSequence()) {
            return value.tag(tag);
        }
        if (value.isMapping()) {
            throw new ParseException("!path expects a path segment or a list of segments", path, origin);
        }
        Node sequence = isEmpty(value) ? Node.emptySequence() : Node.sequence(List.of(value));
        return sequence.origin(origin).tag(tag);
    }

    private static Node interpolation(Node value, String argument, NodePath path, Origin origin) {
        if (!value.isScalar()) {
            throw new ParseException("!fstr expects a template string", path, origin);
        }
        return Node.of(Tag.fstr(), value.scalarValue() == null ? "" : String.valueOf(value.scalarValue())).origin(origin);
    }

    private static PathReference parseReference(String text, String tagName, NodePath path, Origin origin) {
        try {
            return PathReference.parse(text);
        } catch (IllegalArgumentException ex) {
            throw new ParseException(tagName + " has an invalid path: " + ex.getMessage(), path, origin, ex);
        }
    }
}
