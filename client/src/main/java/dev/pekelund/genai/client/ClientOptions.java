package dev.pekelund.genai.client;

/**
 * Transport options supplied by the caller. {@code apiEndpoint} may be a bare host such as
 * {@code generativelanguage.googleapis.com} or a full base URL.
 */
public record ClientOptions(String apiKey, String apiEndpoint, String defaultModel) {

    public static ClientOptions empty() {
        return new ClientOptions(null, null, null);
    }

    public static ClientOptions ofApiKey(String apiKey) {
        return new ClientOptions(apiKey, null, null);
    }
}
