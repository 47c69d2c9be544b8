package dev.pekelund.genai.retriever;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.genai.client.AbstractServiceClient;
import dev.pekelund.genai.client.GenerativeAiSettings;
import dev.pekelund.genai.client.Page;
import dev.pekelund.genai.client.PagedIterable;
import dev.pekelund.genai.client.UpdatePaths;
import io.micrometer.observation.ObservationRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Semantic retrieval operations on corpora, documents and chunks.
 */
public class RetrieverService extends AbstractServiceClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetrieverService.class);

    static final int MAX_RESULTS_COUNT = 100;

    public RetrieverService(RestClient restClient, GenerativeAiSettings settings, ObjectMapper objectMapper,
        ObservationRegistry observationRegistry) {
        super(restClient, settings, objectMapper, observationRegistry);
    }

    // Corpora

    /**
     * Creates a corpus. The name is optional; without it the service assigns one.
     */
    public Corpus createCorpus(String name, String displayName) {
        Corpus corpus = new Corpus(StringUtils.hasText(name) ? ResourceNames.corpus(name) : null, displayName, null, null);
        Corpus created = post("createCorpus", "corpora", "corpora", corpus, Corpus.class);
        LOGGER.info("Created corpus '{}'", created != null ? created.name() : null);
        return created;
    }

    public Corpus getCorpus(String name) {
        String resource = ResourceNames.corpus(name);
        return get("getCorpus", resource, Corpus.class);
    }

    public PagedIterable<Corpus> listCorpora(Integer pageSize) {
        return list("listCorpora", "corpora", pageSize, CorpusList.class,
            response -> new Page<Corpus>(response.corpora(), response.nextPageToken()));
    }

    public Corpus updateCorpus(String name, Map<String, ?> updates) {
        return patch("updateCorpus", ResourceNames.corpus(name), updates, Corpus.class);
    }

    public void deleteCorpus(String name, boolean force) {
        delete("deleteCorpus", ResourceNames.corpus(name), force);
    }

    public List<RelevantChunk> queryCorpus(String name, String query, List<MetadataFilter> metadataFilters,
        Integer resultsCount) {
        return query("queryCorpus", ResourceNames.corpus(name), query, metadataFilters, resultsCount);
    }

    // Documents

    /**
     * Creates a document in a corpus. Either {@code name} or {@code displayName} is required. A
     * full document name is used as given; a bare id is placed under the corpus after stripping
     * punctuation other than {@code -}.
     */
    public Document createDocument(String corpusName, String name, String displayName,
        List<CustomMetadata> customMetadata) {
        String corpus = ResourceNames.corpus(corpusName);
        if (!StringUtils.hasText(name) && !StringUtils.hasText(displayName)) {
            throw new IllegalArgumentException("Either the document name or display name must be specified.");
        }
        String documentName = StringUtils.hasText(name) ? ResourceNames.document(corpus, name) : null;
        Document document = new Document(documentName, displayName, customMetadata, null, null);
        Document created = post("createDocument", corpus, corpus + "/documents", document, Document.class);
        LOGGER.info("Created document '{}' in corpus '{}'", created != null ? created.name() : null, corpus);
        return created;
    }

    public Document getDocument(String name) {
        return get("getDocument", ResourceNames.requireDocument(name), Document.class);
    }

    public PagedIterable<Document> listDocuments(String corpusName, Integer pageSize) {
        String corpus = ResourceNames.corpus(corpusName);
        return list("listDocuments", corpus + "/documents", pageSize, DocumentList.class,
            response -> new Page<Document>(response.documents(), response.nextPageToken()));
    }

    public Document updateDocument(String name, Map<String, ?> updates) {
        return patch("updateDocument", ResourceNames.requireDocument(name), updates, Document.class);
    }

    public void deleteDocument(String name, boolean force) {
        delete("deleteDocument", ResourceNames.requireDocument(name), force);
    }

    public List<RelevantChunk> queryDocument(String name, String query, List<MetadataFilter> metadataFilters,
        Integer resultsCount) {
        return query("queryDocument", ResourceNames.requireDocument(name), query, metadataFilters, resultsCount);
    }

    // Chunks

    public Chunk createChunk(String documentName, String name, String data, List<CustomMetadata> customMetadata) {
        String document = ResourceNames.requireDocument(documentName);
        Chunk chunk = toChunk(document, name, data, customMetadata);
        return post("createChunk", document, document + "/chunks", chunk, Chunk.class);
    }

    /**
     * Creates several chunks in one call; the service accepts at most 100 per batch.
     */
    public List<Chunk> batchCreateChunks(String documentName, List<ChunkInput> inputs) {
        String document = ResourceNames.requireDocument(documentName);
        Assert.notEmpty(inputs, "At least one chunk is required");
        List<CreateChunkRequest> requests = new ArrayList<>(inputs.size());
        for (ChunkInput input : inputs) {
            Chunk chunk;
            if (input instanceof ChunkInput.WithMetadata withMetadata) {
                chunk = toChunk(document, withMetadata.name(), withMetadata.data(), withMetadata.customMetadata());
            } else if (input instanceof ChunkInput.Named named) {
                chunk = toChunk(document, named.name(), named.data(), null);
            } else {
                chunk = new Chunk(null, new ChunkData(input.data()), null, null, null, null);
            }
            requests.add(new CreateChunkRequest(document, chunk));
        }
        ChunkList created = post("batchCreateChunks", document, document + "/chunks:batchCreate",
            new BatchRequest<>(requests), ChunkList.class);
        LOGGER.info("Created {} chunk(s) in document '{}'", requests.size(), document);
        return created != null ? created.chunks() : List.of();
    }

    public Chunk getChunk(String name) {
        return get("getChunk", ResourceNames.requireChunk(name), Chunk.class);
    }

    public PagedIterable<Chunk> listChunks(String documentName, Integer pageSize) {
        String document = ResourceNames.requireDocument(documentName);
        return list("listChunks", document + "/chunks", pageSize, ChunkList.class,
            response -> new Page<Chunk>(response.chunks(), response.nextPageToken()));
    }

    public Chunk updateChunk(String name, Map<String, ?> updates) {
        return patch("updateChunk", ResourceNames.requireChunk(name), updates, Chunk.class);
    }

    /**
     * Updates several chunks of one document. Keys are chunk names, values the nested update maps.
     */
    public List<Chunk> batchUpdateChunks(String documentName, Map<String, ? extends Map<String, ?>> updates) {
        String document = ResourceNames.requireDocument(documentName);
        Assert.notEmpty(updates, "At least one chunk update is required");
        List<UpdateChunkRequest> requests = new ArrayList<>(updates.size());
        updates.forEach((chunkName, chunkUpdates) -> {
            Map<String, Object> flat = flattenUpdates(chunkUpdates);
            Map<String, Object> body = UpdatePaths.expand(flat);
            body.put("name", ResourceNames.requireChunk(chunkName));
            requests.add(new UpdateChunkRequest(body, UpdatePaths.toFieldMask(flat.keySet())));
        });
        ChunkList updated = post("batchUpdateChunks", document, document + "/chunks:batchUpdate",
            new BatchRequest<>(requests), ChunkList.class);
        return updated != null ? updated.chunks() : List.of();
    }

    public void deleteChunk(String name) {
        delete("deleteChunk", ResourceNames.requireChunk(name), false);
    }

    public void batchDeleteChunks(String documentName, List<String> chunkNames) {
        String document = ResourceNames.requireDocument(documentName);
        Assert.notEmpty(chunkNames, "At least one chunk name is required");
        List<DeleteChunkRequest> requests = chunkNames.stream()
            .map(ResourceNames::requireChunk)
            .map(DeleteChunkRequest::new)
            .toList();
        post("batchDeleteChunks", document, document + "/chunks:batchDelete", new BatchRequest<>(requests), Void.class);
        LOGGER.info("Deleted {} chunk(s) from document '{}'", requests.size(), document);
    }

    private static Chunk toChunk(String document, String name, String data, List<CustomMetadata> customMetadata) {
        Assert.notNull(data, "Chunk data must not be null");
        String chunkName = name != null ? ResourceNames.chunk(document, name) : null;
        return new Chunk(chunkName, new ChunkData(data), customMetadata, null, null, null);
    }

    private static Map<String, Object> flattenUpdates(Map<String, ?> updates) {
        Map<String, Object> flat = UpdatePaths.flatten(updates);
        if (flat.isEmpty()) {
            throw new IllegalArgumentException("At least one update is required");
        }
        return flat;
    }

    private <T> T post(String operation, String resource, String path, Object body, Class<T> type) {
        return execute(operation, resource, () -> restClient.post()
            .uri(uriBuilder -> resourcePath(uriBuilder, path).build())
            .contentType(MediaType.APPLICATION_JSON)
            .body(body)
            .retrieve()
            .body(type));
    }

    private <T> T get(String operation, String resource, Class<T> type) {
        return execute(operation, resource, () -> restClient.get()
            .uri(uriBuilder -> resourcePath(uriBuilder, resource).build())
            .retrieve()
            .body(type));
    }

    private <T> T patch(String operation, String resource, Map<String, ?> updates, Class<T> type) {
        Map<String, Object> flat = flattenUpdates(updates);
        Map<String, Object> body = UpdatePaths.expand(flat);
        String updateMask = UpdatePaths.toFieldMask(flat.keySet());
        return execute(operation, resource, () -> restClient.patch()
            .uri(uriBuilder -> resourcePath(uriBuilder, resource)
                .queryParam("updateMask", updateMask)
                .build())
            .contentType(MediaType.APPLICATION_JSON)
            .body(body)
            .retrieve()
            .body(type));
    }

    private void delete(String operation, String resource, boolean force) {
        execute(operation, resource, () -> restClient.delete()
            .uri(uriBuilder -> {
                resourcePath(uriBuilder, resource);
                if (force) {
                    uriBuilder.queryParam("force", true);
                }
                return uriBuilder.build();
            })
            .retrieve()
            .toBodilessEntity());
        LOGGER.info("Deleted '{}'{}", resource, force ? " (force)" : "");
    }

    private List<RelevantChunk> query(String operation, String resource, String query,
        List<MetadataFilter> metadataFilters, Integer resultsCount) {
        Assert.hasText(query, "Query must not be empty");
        if (resultsCount != null && (resultsCount < 1 || resultsCount > MAX_RESULTS_COUNT)) {
            throw new IllegalArgumentException("Number of results returned must be between 1 and 100.");
        }
        QueryRequest body = new QueryRequest(query, metadataFilters, resultsCount);
        QueryResponse response = post(operation, resource, resource + ":query", body, QueryResponse.class);
        return response != null ? response.relevantChunks() : List.of();
    }

    private <L, T> PagedIterable<T> list(String operation, String path, Integer pageSize, Class<L> type,
        Function<L, Page<T>> toPage) {
        return new PagedIterable<>(pageToken -> execute(operation, path, () -> {
            L response = restClient.get()
                .uri(uriBuilder -> {
                    resourcePath(uriBuilder, path);
                    if (pageSize != null) {
                        uriBuilder.queryParam("pageSize", pageSize);
                    }
                    if (pageToken != null) {
                        uriBuilder.queryParam("pageToken", pageToken);
                    }
                    return uriBuilder.build();
                })
                .retrieve()
                .body(type);
            return response != null ? toPage.apply(response) : new Page<T>(List.of(), null);
        }));
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private record QueryRequest(String query, List<MetadataFilter> metadataFilters, Integer resultsCount) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record QueryResponse(List<RelevantChunk> relevantChunks) {

        QueryResponse {
            relevantChunks = relevantChunks != null ? relevantChunks : List.of();
        }
    }

    private record BatchRequest<R>(List<R> requests) {
    }

    private record CreateChunkRequest(String parent, Chunk chunk) {
    }

    private record UpdateChunkRequest(Map<String, Object> chunk, String updateMask) {
    }

    private record DeleteChunkRequest(String name) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record CorpusList(List<Corpus> corpora, String nextPageToken) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record DocumentList(List<Document> documents, String nextPageToken) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ChunkList(List<Chunk> chunks, String nextPageToken) {

        ChunkList {
            chunks = chunks != null ? chunks : List.of();
        }
    }
}
