package dev.pekelund.genai.client;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Populates MDC entries so log lines emitted during one remote call share the operation and
 * resource they belong to.
 */
public final class GenerativeAiMdc {

    public static final String KEY_OPERATION = "genai.operation";
    public static final String KEY_RESOURCE = "genai.resource";

    private GenerativeAiMdc() {
        // Utility class
    }

    public static Context open(String operation, String resource) {
        return new Context(operation, resource);
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    public static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String operation, String resource) {
            this.previous = MDC.getCopyOfContextMap();
            putIfHasText(KEY_OPERATION, operation);
            putIfHasText(KEY_RESOURCE, resource);
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
