package dev.pekelund.genai.content;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Inline binary payload; {@code data} is base64 encoded on the wire.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Blob(String mimeType, String data) {
}
