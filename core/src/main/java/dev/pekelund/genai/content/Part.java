package dev.pekelund.genai.content;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Base64;
import java.util.Map;

/**
 * One element of a {@link Content}. A part is either text ({@code text} set) or carries exactly one
 * non-text payload such as inline data or a function call.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Part(
    String text,
    Blob inlineData,
    FileData fileData,
    FunctionCall functionCall,
    FunctionResponse functionResponse
) {

    public static Part fromText(String text) {
        return new Part(text != null ? text : "", null, null, null, null);
    }

    public static Part inlineData(String mimeType, byte[] data) {
        return new Part(null, new Blob(mimeType, Base64.getEncoder().encodeToString(data)), null, null, null);
    }

    public static Part fileData(String mimeType, String fileUri) {
        return new Part(null, null, new FileData(mimeType, fileUri), null, null);
    }

    public static Part functionCall(String name, Map<String, Object> args) {
        return new Part(null, null, null, new FunctionCall(name, args), null);
    }

    public static Part functionResponse(String name, Map<String, Object> response) {
        return new Part(null, null, null, null, new FunctionResponse(name, response));
    }

    public boolean hasText() {
        return text != null;
    }

    public Part withText(String newText) {
        return new Part(newText, inlineData, fileData, functionCall, functionResponse);
    }
}
