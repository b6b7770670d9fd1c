package work.lcod.config.node;

import java.util.Objects;

/**
 * Semantic kind of a node. Tags are plain values so that extension tags can be carried
 * through merge without any change to the core.
 *
 * @param name tag name without the leading {@code !}, empty for plain nodes
 * @param argument text following {@code :} in the tag (for example {@code cwd} in {@code !path:cwd}), or null
 * @param category how the evaluator treats the tagged node
 */
public record Tag(String name, String argument, Category category) {
    public static final String REQUIRED = "required";
    public static final String REF = "ref";
    public static final String PATH = "path";
    public static final String FSTR = "fstr";
    public static final String INCLUDE = "include";
    public static final String PREV = "prev";
    public static final String CLEAR = "clear";

    public static final Tag PLAIN = new Tag("", null, Category.PLAIN);

    public Tag {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
        if (argument != null && argument.isEmpty()) {
            argument = null;
        }
    }

    public static Tag required() {
        return new Tag(REQUIRED, null, Category.DEFERRED);
    }

    public static Tag ref() {
        return new Tag(REF, null, Category.DEFERRED);
    }

    public static Tag path(String referencePoint) {
        return new Tag(PATH, referencePoint, Category.DEFERRED);
    }

    public static Tag fstr() {
        return new Tag(FSTR, null, Category.DEFERRED);
    }

    public static Tag include() {
        return new Tag(INCLUDE, null, Category.DIRECTIVE);
    }

    /**
     * Takes the node at the path given as value out of the trees merged before, and puts it here.
     */
    public static Tag prev() {
        return new Tag(PREV, null, Category.DIRECTIVE);
    }

    /**
     * Empties the node merged before at the same path, keeping its tag.
     */
    public static Tag clear() {
        return new Tag(CLEAR, null, Category.DIRECTIVE);
    }

    public static Tag dynamic(String name, String argument) {
        return new Tag(name, argument, Category.DYNAMIC);
    }

    public boolean is(String tagName) {
        return name.equals(tagName);
    }

    public boolean isDirective(String tagName) {
        return category == Category.DIRECTIVE && name.equals(tagName);
    }

    public boolean isPlain() {
        return category == Category.PLAIN;
    }

    /**
     * True for tags whose node is replaced by a computed value during evaluation.
     */
    public boolean isDeferred() {
        return category == Category.DEFERRED || category == Category.DYNAMIC;
    }

    @Override
    public String toString() {
        if (isPlain()) {
            return "plain";
        }
        return argument == null ? "!" + name : "!" + name + ":" + argument;
    }

    public enum Category {
        PLAIN,
        DEFERRED,
        DYNAMIC,
        DIRECTIVE
    }
}
