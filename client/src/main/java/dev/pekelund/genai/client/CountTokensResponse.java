package dev.pekelund.genai.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CountTokensResponse(Integer totalTokens, Integer cachedContentTokenCount) {
}
