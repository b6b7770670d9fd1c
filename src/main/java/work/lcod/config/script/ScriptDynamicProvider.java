package work.lcod.config.script;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.config.eval.DynamicExpression;
import work.lcod.config.eval.DynamicProvider;
import work.lcod.config.node.NodePath;

/**
 * Evaluates {@code !eval} nodes with the GraalVM JavaScript engine.
 *
 * <p>The payload is either the expression text or a mapping {@code {code: ..., with: {name: value}}};
 * every {@code with} entry becomes a global of the script. The value of the last statement is the result,
 * promises are awaited.</p>
 */
public final class ScriptDynamicProvider implements DynamicProvider {
    public static final String TAG = "eval";

    private static final Logger log = LoggerFactory.getLogger(ScriptDynamicProvider.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    /**
     * Whether a JavaScript engine is on the class path.
     */
    public static boolean isAvailable() {
        try (Context trial = newContext()) {
            trial.eval("js", "0");
            return true;
        } catch (RuntimeException ex) {
            log.debug("JavaScript engine unavailable: {}", ex.getMessage());
            return false;
        }
    }

    @Override
    public Object evaluate(DynamicExpression expression, Map<NodePath, Object> dependencies) throws Exception {
        Object payload = expression.payload();
        String code;
        Map<String, Object> globals = Map.of();
        if (payload instanceof String text) {
            code = text;
        } else if (payload instanceof Map<?, ?> map && map.get("code") instanceof String text) {
            code = text;
            globals = asObject(map.get("with"));
        } else {
            throw new IllegalArgumentException("!eval expects a script or a mapping with a 'code' entry");
        }
        if (code.isBlank()) {
            throw new IllegalArgumentException("!eval script is empty");
        }

        log.debug("Evaluating script at '{}'", expression.path());
        try (Context polyglot = newContext()) {
            Value bindings = polyglot.getBindings("js");
            for (Map.Entry<String, Object> entry : globals.entrySet()) {
                bindings.putMember(entry.getKey(), toJsValue(polyglot, entry.getValue()));
            }
            Value raw = polyglot.eval("js", code);
            return awaitValue(polyglot, raw);
        }
    }

    private static Context newContext() {
        return Context
            .newBuilder("js")
            .allowExperimentalOptions(true)
            .option("engine.WarnInterpreterOnly", "false")
            .option("js.ecmascript-version", "2023")
            .build();
    }

    private static Map<String, Object> asObject(Object raw) {
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("!eval 'with' must be a mapping of names to values");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }

    private static Object awaitValue(Context context, Value value) throws ExecutionException, InterruptedException {
        if (value != null && value.canInvokeMember("then")) {
            CompletableFuture<Object> future = new CompletableFuture<>();
            ProxyExecutable resolve = args -> {
                future.complete(valueToJava(args.length > 0 ? args[0] : context.eval("js", "undefined")));
                return null;
            };
            ProxyExecutable reject = args -> {
                Object reason = args.length > 0 ? valueToJava(args[0]) : "Promise rejected";
                future.completeExceptionally(new IllegalStateException("Script promise rejected: " + render(reason)));
                return null;
            };
            value.invokeMember("then", resolve, reject);
            return future.get();
        }
        return valueToJava(value);
    }

    private static String render(Object reason) {
        if (reason instanceof Map || reason instanceof List) {
            try {
                return JSON.writeValueAsString(reason);
            } catch (JsonProcessingException ex) {
                log.debug("Cannot render rejection reason as JSON", ex);
            }
        }
        return String.valueOf(reason);
    }

    static Object valueToJava(Value value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNumber()) {
            if (value.fitsInLong()) return value.asLong();
            return value.asDouble();
        }
        if (value.isString()) {
            return value.asString();
        }
        if (value.isHostObject()) {
            return value.asHostObject();
        }
        if (value.hasArrayElements()) {
            List<Object> list = new ArrayList<>();
            long size = value.getArraySize();
            for (long i = 0; i < size; i++) {
                list.add(valueToJava(value.getArrayElement(i)));
            }
            return list;
        }
        if (value.hasMembers()) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : value.getMemberKeys()) {
                map.put(key, valueToJava(value.getMember(key)));
            }
            return map;
        }
        return value.toString();
    }

    private static Value toJsValue(Context context, Object value) throws JsonProcessingException {
        String serialized = JSON.writeValueAsString(value);
        return context.eval("js", "JSON").getMember("parse").execute(serialized);
    }
}
