package work.lcod.config.format;

import java.math.BigInteger;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Resolves the text of an explicitly tagged scalar the way an untagged plain scalar would have been typed.
 * The YAML parser hands tagged scalars over as strings, so {@code !force 5} would otherwise stay {@code "5"}.
 */
final class PlainScalars {
    private static final Set<String> NULLS = Set.of("", "~", "null", "Null", "NULL");
    private static final Set<String> TRUES = Set.of("true", "True", "TRUE");
    private static final Set<String> FALSES = Set.of("false", "False", "FALSE");
    private static final Pattern INT = Pattern.compile("[-+]?[0-9]+");
    private static final Pattern FLOAT = Pattern.compile("[-+]?(\\.[0-9]+|[0-9]+(\\.[0-9]*)?)([eE][-+]?[0-9]+)?");

    private PlainScalars() {}

    static Object resolve(String text) {
        if (text == null || NULLS.contains(text)) {
            return null;
        }
        if (TRUES.contains(text)) {
            return Boolean.TRUE;
        }
        if (FALSES.contains(text)) {
            return Boolean.FALSE;
        }
        if (INT.matcher(text).matches()) {
            var value = new BigInteger(text.startsWith("+") ? text.substring(1) : text);
            return value.bitLength() < 64 ? (Object) value.longValue() : value;
        }
        if (FLOAT.matcher(text).matches()) {
            return Double.parseDouble(text);
        }
        return switch (text) {
            case ".inf", ".Inf", ".INF", "+.inf", "+.Inf", "+.INF" -> Double.POSITIVE_INFINITY;
            case "-.inf", "-.Inf", "-.INF" -> Double.NEGATIVE_INFINITY;
            case ".nan", ".NaN", ".NAN" -> Double.NaN;
            default -> text;
        };
    }
}
