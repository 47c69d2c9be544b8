package dev.pekelund.genai.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.genai.GenerativeAiException;
import dev.pekelund.genai.GenerativeAiJson;
import dev.pekelund.genai.content.Content;
import dev.pekelund.genai.content.FinishReason;
import dev.pekelund.genai.content.GenerateContentChunk;
import dev.pekelund.genai.generation.GenerateContentRequest;
import dev.pekelund.genai.generation.GenerationConfig;
import dev.pekelund.genai.response.GenerateContentResponse;
import dev.pekelund.genai.response.StreamState;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.match.MockRestRequestMatchers;
import org.springframework.test.web.client.response.MockRestResponseCreators;
import org.springframework.web.client.RestClient;

class GenerativeServiceClientTest {

    private static final String MODEL_URL = "http://localhost/v1beta/models/gemini-1.5-flash";

    private MockRestServiceServer server;
    private GenerativeServiceClient client;

    @BeforeEach
    void setUp() {
        GenerativeAiSettings settings = GenerativeAiSettings.configure("test-key",
            new ClientOptions(null, "http://localhost/v1beta", null), Map.of("x-goog-request-params", "team"), null,
            Map.of());
        RestClient.Builder restClientBuilder = GenerativeAiRestClients.builder(settings,
            GenerativeAiJson.newObjectMapper());
        server = MockRestServiceServer.bindTo(restClientBuilder).build();
        client = new GenerativeServiceClient(restClientBuilder.build(), settings, GenerativeAiJson.newObjectMapper(),
            null);
    }

    @Test
    void generateContentPostsRequestAndParsesResponse() {
        server.expect(ExpectedCount.once(),
                MockRestRequestMatchers.requestTo(MODEL_URL + ":generateContent?key=test-key"))
            .andExpect(MockRestRequestMatchers.method(HttpMethod.POST))
            .andExpect(MockRestRequestMatchers.header(GenerativeAiRestClients.API_CLIENT_HEADER,
                GenerativeAiSettings.sdkUserAgent()))
            .andExpect(MockRestRequestMatchers.header("x-goog-request-params", "team"))
            .andExpect(MockRestRequestMatchers.content().json(
                "{\"contents\":[{\"role\":\"user\",\"parts\":[{\"text\":\"Hi\"}]}]}"))
            .andRespond(MockRestResponseCreators.withSuccess("{"
                + "\"candidates\":[{\"content\":{\"role\":\"model\",\"parts\":[{\"text\":\"Hello!\"}]},"
                + "\"finishReason\":\"STOP\"}],"
                + "\"usageMetadata\":{\"promptTokenCount\":2,\"candidatesTokenCount\":3,\"totalTokenCount\":5}}",
                MediaType.APPLICATION_JSON));

        GenerateContentChunk chunk = client.generateContent("gemini-1.5-flash",
            GenerateContentRequest.of(List.of(Content.user("Hi"))));

        server.verify();
        assertThat(chunk.candidates()).hasSize(1);
        assertThat(chunk.candidates().get(0).finishReason()).isEqualTo(FinishReason.STOP);
        assertThat(chunk.candidates().get(0).parts().get(0).text()).isEqualTo("Hello!");
        assertThat(chunk.usageMetadata().totalTokenCount()).isEqualTo(5);
    }

    @Test
    void streamGenerateContentReadsServerSentEvents() {
        String body = "data: {\"candidates\":[{\"content\":{\"role\":\"model\",\"parts\":[{\"text\":\"Hello\"}]}}]}\n"
            + "\n"
            + ": keep-alive\n"
            + "data: {\"candidates\":[{\"content\":{\"role\":\"model\",\"parts\":[{\"text\":\" world\"}]},"
            + "\"finishReason\":\"STOP\"}]}\n"
            + "\n";
        server.expect(ExpectedCount.once(),
                MockRestRequestMatchers.requestTo(MODEL_URL + ":streamGenerateContent?key=test-key&alt=sse"))
            .andExpect(MockRestRequestMatchers.method(HttpMethod.POST))
            .andExpect(MockRestRequestMatchers.header("Accept", MediaType.TEXT_EVENT_STREAM_VALUE))
            .andRespond(MockRestResponseCreators.withSuccess(body, MediaType.TEXT_EVENT_STREAM));

        GenerateContentResponse response = GenerateContentResponse.fromSource(
            client.streamGenerateContent("gemini-1.5-flash", GenerateContentRequest.of(List.of(Content.user("Hi")))));
        response.drain();

        server.verify();
        assertThat(response.state()).isEqualTo(StreamState.DONE);
        assertThat(response.text()).isEqualTo("Hello world");
        assertThat(response.candidates().get(0).finishReason()).isEqualTo(FinishReason.STOP);
    }

    @Test
    void errorStatusBecomesGenerativeAiException() {
        server.expect(ExpectedCount.once(),
                MockRestRequestMatchers.requestTo(MODEL_URL + ":generateContent?key=test-key"))
            .andRespond(MockRestResponseCreators.withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":{\"message\":\"API key not valid\"}}"));

        assertThatThrownBy(() -> client.generateContent("gemini-1.5-flash",
            GenerateContentRequest.of(List.of(Content.user("Hi")))))
            .isInstanceOf(GenerativeAiException.class)
            .hasMessageContaining("generateContent")
            .hasMessageContaining("400")
            .hasMessageContaining("API key not valid");
    }

    @Test
    void streamErrorStatusFailsBeforeAnyChunk() {
        server.expect(ExpectedCount.once(),
                MockRestRequestMatchers.requestTo(MODEL_URL + ":streamGenerateContent?key=test-key&alt=sse"))
            .andRespond(MockRestResponseCreators.withStatus(HttpStatus.TOO_MANY_REQUESTS)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":{\"message\":\"Quota exceeded\"}}"));

        assertThatThrownBy(() -> client.streamGenerateContent("gemini-1.5-flash",
            GenerateContentRequest.of(List.of(Content.user("Hi")))))
            .isInstanceOf(GenerativeAiException.class)
            .hasMessageContaining("429")
            .hasMessageContaining("Quota exceeded");
    }

    @Test
    void countTokensSendsBareContents() {
        server.expect(ExpectedCount.once(), MockRestRequestMatchers.requestTo(MODEL_URL + ":countTokens?key=test-key"))
            .andExpect(MockRestRequestMatchers.content().json(
                "{\"contents\":[{\"role\":\"user\",\"parts\":[{\"text\":\"Count me\"}]}]}", true))
            .andRespond(MockRestResponseCreators.withSuccess("{\"totalTokens\":3}", MediaType.APPLICATION_JSON));

        CountTokensResponse response = client.countTokens("gemini-1.5-flash",
            GenerateContentRequest.of(List.of(Content.user("Count me"))));

        server.verify();
        assertThat(response.totalTokens()).isEqualTo(3);
    }

    @Test
    void countTokensWrapsFullRequestWithModel() {
        server.expect(ExpectedCount.once(), MockRestRequestMatchers.requestTo(MODEL_URL + ":countTokens?key=test-key"))
            .andExpect(MockRestRequestMatchers.content().json("{\"generateContentRequest\":{"
                + "\"model\":\"models/gemini-1.5-flash\","
                + "\"contents\":[{\"role\":\"user\",\"parts\":[{\"text\":\"Count me\"}]}],"
                + "\"generationConfig\":{\"temperature\":0.1}}}", true))
            .andRespond(MockRestResponseCreators.withSuccess("{\"totalTokens\":3}", MediaType.APPLICATION_JSON));

        GenerateContentRequest request = new GenerateContentRequest(List.of(Content.user("Count me")), null,
            GenerationConfig.builder().temperature(0.1).build(), null, null);

        assertThat(client.countTokens("models/gemini-1.5-flash", request).totalTokens()).isEqualTo(3);
        server.verify();
    }

    @Test
    void rejectsRequestWithoutContents() {
        assertThatThrownBy(() -> client.generateContent("gemini-1.5-flash", GenerateContentRequest.of(List.of())))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("at least one content item");
        server.verify();
    }

    @Test
    void modelNameQualifiesBareIds() {
        assertThat(GenerativeServiceClient.modelName("gemini-pro")).isEqualTo("models/gemini-pro");
        assertThat(GenerativeServiceClient.modelName("models/gemini-pro")).isEqualTo("models/gemini-pro");
        assertThat(GenerativeServiceClient.modelName("tunedModels/my-model")).isEqualTo("tunedModels/my-model");
    }
}
