package work.lcod.config.eval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * {@code !fstr} templates: literal text with placeholders naming tree paths in braces. Doubled braces stand for literal ones.
 */
public final class Interpolation {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final String template;
    private final List<Part> parts;

    private Interpolation(String template, List<Part> parts) {
        this.template = template;
        this.parts = parts;
    }

    public static Interpolation parse(String template) {
        var parts = new ArrayList<Part>();
        var literal = new StringBuilder();
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '{' && i + 1 < template.length() && template.charAt(i + 1) == '{') {
                literal.append('{');
                i += 2;
            } else if (c == '}' && i + 1 < template.length() && template.charAt(i + 1) == '}') {
                literal.append('}');
                i += 2;
            } else if (c == '{') {
                int close = template.indexOf('}', i + 1);
                if (close < 0) {
                    throw new IllegalArgumentException("Unclosed '{' at offset " + i + " in template: " + template);
                }
                String placeholder = template.substring(i + 1, close).trim();
                if (placeholder.isEmpty()) {
                    throw new IllegalArgumentException("Empty placeholder at offset " + i + " in template: " + template);
                }
                if (literal.length() > 0) {
                    parts.add(new Part(literal.toString(), null));
                    literal.setLength(0);
                }
                parts.add(new Part(null, placeholder));
                i = close + 1;
            } else if (c == '}') {
                throw new IllegalArgumentException("Unmatched '}' at offset " + i + " in template: " + template);
            } else {
                literal.append(c);
                i++;
            }
        }
        if (literal.length() > 0) {
            parts.add(new Part(literal.toString(), null));
        }
        return new Interpolation(template, List.copyOf(parts));
    }

    public List<String> placeholders() {
        return parts.stream().filter(Part::isPlaceholder).map(Part::placeholder).toList();
    }

    public String render(Function<String, Object> values) {
        var builder = new StringBuilder();
        for (Part part : parts) {
            builder.append(part.isPlaceholder() ? stringify(values.apply(part.placeholder())) : part.literal());
        }
        return builder.toString();
    }

    /**
     * Text substituted for a value: scalars via {@link String#valueOf(Object)}, sequences and mappings as compact JSON.
     */
    public static String stringify(Object value) {
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            try {
                return JSON.writeValueAsString(value);
            } catch (JsonProcessingException ex) {
                throw new IllegalStateException("Cannot render value as JSON: " + ex.getOriginalMessage(), ex);
            }
        }
        return String.valueOf(value);
    }

    public String template() {
        return template;
    }

    private record Part(String literal, String placeholder) {
        boolean isPlaceholder() {
            return placeholder != null;
        }
    }
}
