package dev.pekelund.genai.content;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.genai.GenerativeAiJson;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GenerateContentChunkJsonTest {

    private final ObjectMapper objectMapper = GenerativeAiJson.newObjectMapper();

    @Test
    void readsServiceResponse() throws Exception {
        String json = """
            {
              "candidates": [{
                "content": {"role": "model", "parts": [{"text": "Hi"}, {"functionCall": {"name": "f", "args": {"x": 1}}}]},
                "finishReason": "STOP",
                "safetyRatings": [{"category": "HARM_CATEGORY_HARASSMENT", "probability": "NEGLIGIBLE"}],
                "avgLogprobs": -0.1
              }],
              "usageMetadata": {"promptTokenCount": 4, "candidatesTokenCount": 1, "totalTokenCount": 5},
              "modelVersion": "gemini-1.5-flash-002"
            }
            """;

        GenerateContentChunk chunk = objectMapper.readValue(json, GenerateContentChunk.class);

        Candidate candidate = chunk.candidates().get(0);
        assertThat(candidate.index()).isZero();
        assertThat(candidate.finishReason()).isEqualTo(FinishReason.STOP);
        assertThat(candidate.parts()).hasSize(2);
        assertThat(candidate.parts().get(0).text()).isEqualTo("Hi");
        assertThat(candidate.parts().get(1).functionCall().args()).isEqualTo(Map.of("x", 1));
        assertThat(candidate.safetyRatings()).containsExactly(
            new SafetyRating(HarmCategory.HARM_CATEGORY_HARASSMENT, HarmProbability.NEGLIGIBLE, false));
        assertThat(chunk.promptFeedback()).isNull();
        assertThat(chunk.usageMetadata().totalTokenCount()).isEqualTo(5);
    }

    @Test
    void mapsUnknownEnumValuesToUnspecified() throws Exception {
        String json = """
            {"candidates": [{"index": 1, "finishReason": "SOMETHING_NEW"}],
             "promptFeedback": {"blockReason": "BRAND_NEW_REASON"}}
            """;

        GenerateContentChunk chunk = objectMapper.readValue(json, GenerateContentChunk.class);

        assertThat(chunk.candidates().get(0).index()).isEqualTo(1);
        assertThat(chunk.candidates().get(0).finishReason()).isEqualTo(FinishReason.FINISH_REASON_UNSPECIFIED);
        assertThat(chunk.candidates().get(0).parts()).isEmpty();
        assertThat(chunk.promptFeedback().blockReason()).isEqualTo(BlockReason.BLOCK_REASON_UNSPECIFIED);
        assertThat(chunk.promptBlocked()).isFalse();
    }

    @Test
    void writesPartsWithoutNullFields() throws Exception {
        String json = objectMapper.writeValueAsString(Content.of(Content.ROLE_USER,
            Part.fromText("Describe"), Part.inlineData("image/png", new byte[] {1, 2, 3})));

        assertThat(json).isEqualTo(
            "{\"role\":\"user\",\"parts\":[{\"text\":\"Describe\"},{\"inlineData\":{\"mimeType\":\"image/png\",\"data\":\"AQID\"}}]}");
    }
}
