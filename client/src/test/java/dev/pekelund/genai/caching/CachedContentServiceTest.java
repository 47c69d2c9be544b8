package dev.pekelund.genai.caching;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.genai.GenerativeAiJson;
import dev.pekelund.genai.client.ClientOptions;
import dev.pekelund.genai.client.GenerativeAiRestClients;
import dev.pekelund.genai.client.GenerativeAiSettings;
import dev.pekelund.genai.content.Content;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.match.MockRestRequestMatchers;
import org.springframework.test.web.client.response.MockRestResponseCreators;
import org.springframework.web.client.RestClient;

class CachedContentServiceTest {

    private static final String BASE_URL = "http://localhost/v1beta";

    private static final String CACHED_JSON = "{"
        + "\"name\":\"cachedContents/abc123\","
        + "\"model\":\"models/gemini-1.5-flash-001\","
        + "\"displayName\":\"Manual\","
        + "\"usageMetadata\":{\"totalTokenCount\":32768},"
        + "\"createTime\":\"2024-05-01T10:00:00Z\","
        + "\"expireTime\":\"2024-05-01T11:00:00Z\"}";

    private MockRestServiceServer server;
    private CachedContentService service;

    @BeforeEach
    void setUp() {
        GenerativeAiSettings settings = GenerativeAiSettings.configure("test-key",
            new ClientOptions(null, BASE_URL, null), null, null, Map.of());
        RestClient.Builder restClientBuilder = GenerativeAiRestClients.builder(settings,
            GenerativeAiJson.newObjectMapper());
        server = MockRestServiceServer.bindTo(restClientBuilder).build();
        service = new CachedContentService(restClientBuilder.build(), settings, GenerativeAiJson.newObjectMapper(),
            null);
    }

    @Test
    void createPostsModelContentsAndTtl() {
        server.expect(ExpectedCount.once(), MockRestRequestMatchers.requestTo(BASE_URL + "/cachedContents?key=test-key"))
            .andExpect(MockRestRequestMatchers.method(HttpMethod.POST))
            .andExpect(MockRestRequestMatchers.content().json("{"
                + "\"model\":\"models/gemini-1.5-flash-001\","
                + "\"displayName\":\"Manual\","
                + "\"systemInstruction\":{\"parts\":[{\"text\":\"You answer from the manual.\"}]},"
                + "\"contents\":[{\"role\":\"user\",\"parts\":[{\"text\":\"Chapter 1\"}]}],"
                + "\"ttl\":\"3600s\"}", true))
            .andRespond(MockRestResponseCreators.withSuccess(CACHED_JSON, MediaType.APPLICATION_JSON));

        CachedContent created = service.create(CreateCachedContentRequest.builder("gemini-1.5-flash-001")
            .displayName("Manual")
            .systemInstruction("You answer from the manual.")
            .contents(List.of(Content.user("Chapter 1")))
            .ttl(Duration.ofHours(1))
            .build());

        server.verify();
        assertThat(created.name()).isEqualTo("cachedContents/abc123");
        assertThat(created.usageMetadata().totalTokenCount()).isEqualTo(32768);
        assertThat(created.expireTime()).isEqualTo(Instant.parse("2024-05-01T11:00:00Z"));
    }

    @Test
    void getQualifiesBareName() {
        server.expect(ExpectedCount.once(),
                MockRestRequestMatchers.requestTo(BASE_URL + "/cachedContents/abc123?key=test-key"))
            .andExpect(MockRestRequestMatchers.method(HttpMethod.GET))
            .andRespond(MockRestResponseCreators.withSuccess(CACHED_JSON, MediaType.APPLICATION_JSON));

        assertThat(service.get("abc123").displayName()).isEqualTo("Manual");
        server.verify();
    }

    @Test
    void listFollowsPageTokens() {
        server.expect(ExpectedCount.once(),
                MockRestRequestMatchers.requestTo(BASE_URL + "/cachedContents?key=test-key&pageSize=1"))
            .andRespond(MockRestResponseCreators.withSuccess(
                "{\"cachedContents\":[" + CACHED_JSON + "],\"nextPageToken\":\"next\"}", MediaType.APPLICATION_JSON));
        server.expect(ExpectedCount.once(),
                MockRestRequestMatchers.requestTo(BASE_URL + "/cachedContents?key=test-key&pageSize=1&pageToken=next"))
            .andRespond(MockRestResponseCreators.withSuccess(
                "{\"cachedContents\":[{\"name\":\"cachedContents/def456\"}]}", MediaType.APPLICATION_JSON));

        List<String> names = service.list(1).stream().map(CachedContent::name).toList();

        server.verify();
        assertThat(names).containsExactly("cachedContents/abc123", "cachedContents/def456");
    }

    @Test
    void updateSendsTtlWithUpdateMask() {
        server.expect(ExpectedCount.once(),
                MockRestRequestMatchers.requestTo(BASE_URL + "/cachedContents/abc123?key=test-key&updateMask=ttl"))
            .andExpect(MockRestRequestMatchers.method(HttpMethod.PATCH))
            .andExpect(MockRestRequestMatchers.content().json("{\"ttl\":\"7200s\"}", true))
            .andRespond(MockRestResponseCreators.withSuccess(CACHED_JSON, MediaType.APPLICATION_JSON));

        service.update("cachedContents/abc123", Map.of("ttl", Duration.ofHours(2)));

        server.verify();
    }

    @Test
    void updateSendsExpireTime() {
        server.expect(ExpectedCount.once(),
                MockRestRequestMatchers.requestTo(BASE_URL + "/cachedContents/abc123?key=test-key&updateMask=expireTime"))
            .andExpect(MockRestRequestMatchers.content().json("{\"expireTime\":\"2024-06-01T00:00:00Z\"}", true))
            .andRespond(MockRestResponseCreators.withSuccess(CACHED_JSON, MediaType.APPLICATION_JSON));

        service.update("abc123", Map.of("expire_time", "2024-06-01T00:00:00Z"));

        server.verify();
    }

    @Test
    void updateRejectsOtherFields() {
        assertThatThrownBy(() -> service.update("abc123", Map.of("display_name", "Renamed")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("only `ttl` or `expire_time`")
            .hasMessageContaining("display_name");
    }

    @Test
    void updateRejectsTtlTogetherWithExpireTime() {
        assertThatThrownBy(() -> service.update("abc123",
            Map.of("ttl", 60, "expire_time", Instant.parse("2024-06-01T00:00:00Z"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Exclusive arguments");
    }

    @Test
    void updateRejectsMalformedExpireTime() {
        assertThatThrownBy(() -> service.update("abc123", Map.of("expire_time", "tomorrow")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("RFC 3339");
    }

    @Test
    void deleteSendsDelete() {
        server.expect(ExpectedCount.once(),
                MockRestRequestMatchers.requestTo(BASE_URL + "/cachedContents/abc123?key=test-key"))
            .andExpect(MockRestRequestMatchers.method(HttpMethod.DELETE))
            .andRespond(MockRestResponseCreators.withSuccess());

        service.delete("abc123");

        server.verify();
    }
}
