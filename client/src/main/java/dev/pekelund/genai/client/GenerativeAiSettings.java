package dev.pekelund.genai.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Connection settings resolved once when a client is configured.
 */
public record GenerativeAiSettings(
    String apiKey,
    String baseUrl,
    String defaultModel,
    String userAgent,
    Map<String, String> defaultMetadata
) {

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";
    public static final String DEFAULT_MODEL = "gemini-1.5-flash";
    public static final String API_KEY_ENV = "GOOGLE_API_KEY";
    public static final String BASE_URL_ENV = "GOOGLE_AI_BASE_URL";
    public static final String MODEL_ENV = "GOOGLE_AI_MODEL";

    private static final String USER_AGENT_PRODUCT = "genai-java";
    private static final String API_VERSION_PATH = "/v1beta";

    public GenerativeAiSettings {
        baseUrl = StringUtils.hasText(baseUrl) ? baseUrl : DEFAULT_BASE_URL;
        defaultModel = StringUtils.hasText(defaultModel) ? defaultModel : DEFAULT_MODEL;
        userAgent = StringUtils.hasText(userAgent) ? userAgent : sdkUserAgent();
        defaultMetadata = defaultMetadata != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(defaultMetadata))
            : Map.of();
    }

    public static GenerativeAiSettings fromEnvironment() {
        return configure(null, null, null, null, System.getenv());
    }

    public static GenerativeAiSettings configure(String apiKey, ClientOptions clientOptions,
        Map<String, String> defaultMetadata, String userAgent) {
        return configure(apiKey, clientOptions, defaultMetadata, userAgent, System.getenv());
    }

    /**
     * Resolves the settings the way every client of this library is configured.
     *
     * <p>An API key may be passed directly or on the client options, not both. Without either the
     * {@code GOOGLE_API_KEY} environment variable is used. A caller supplied user agent is kept and
     * the library's own agent is appended to it.
     *
     * @throws IllegalArgumentException when the API key is set both directly and on the options
     */
    public static GenerativeAiSettings configure(String apiKey, ClientOptions clientOptions,
        Map<String, String> defaultMetadata, String userAgent, Map<String, String> env) {

        Objects.requireNonNull(env, "env");
        ClientOptions options = clientOptions != null ? clientOptions : ClientOptions.empty();

        String resolvedKey;
        if (StringUtils.hasText(options.apiKey())) {
            if (apiKey != null) {
                throw new IllegalArgumentException("You can't set both `apiKey` and `clientOptions.apiKey`.");
            }
            resolvedKey = options.apiKey();
        } else {
            resolvedKey = apiKey != null ? apiKey : env.get(API_KEY_ENV);
        }

        String baseUrl = firstNonEmpty(toBaseUrl(options.apiEndpoint()), env.get(BASE_URL_ENV), DEFAULT_BASE_URL);
        String model = firstNonEmpty(options.defaultModel(), env.get(MODEL_ENV), DEFAULT_MODEL);
        String agent = StringUtils.hasText(userAgent) ? userAgent + " " + sdkUserAgent() : sdkUserAgent();

        return new GenerativeAiSettings(resolvedKey, baseUrl, model, agent, defaultMetadata);
    }

    public static String sdkUserAgent() {
        String version = GenerativeAiSettings.class.getPackage().getImplementationVersion();
        return USER_AGENT_PRODUCT + "/" + (StringUtils.hasText(version) ? version : "0.0.0");
    }

    public String requireApiKey() {
        if (!StringUtils.hasText(apiKey)) {
            throw new IllegalStateException("Google AI API key must be configured (" + API_KEY_ENV
                + " or google.ai.generative.api-key)");
        }
        return apiKey;
    }

    private static String toBaseUrl(String apiEndpoint) {
        if (!StringUtils.hasText(apiEndpoint)) {
            return null;
        }
        if (apiEndpoint.contains("://")) {
            return apiEndpoint;
        }
        return "https://" + apiEndpoint + API_VERSION_PATH;
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                return value;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "GenerativeAiSettings{"
            + "apiKey=" + (StringUtils.hasText(apiKey) ? "****" : "(unset)")
            + ", baseUrl='" + baseUrl + '\''
            + ", defaultModel='" + defaultModel + '\''
            + ", userAgent='" + userAgent + '\''
            + ", defaultMetadata=" + defaultMetadata.keySet()
            + '}';
    }
}
