package dev.pekelund.genai.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.genai.content.GenerateContentChunk;
import dev.pekelund.genai.response.ChunkSignal;
import dev.pekelund.genai.response.ChunkSource;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads response chunks from a {@code text/event-stream} body. Each event's {@code data:} lines
 * hold one JSON chunk. The underlying response is closed once the stream ends, fails to read or is
 * closed by the response that consumes it.
 */
final class SseChunkSource implements ChunkSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(SseChunkSource.class);

    private static final String DATA_FIELD = "data:";

    private final BufferedReader reader;
    private final Closeable response;
    private final ObjectMapper objectMapper;
    private volatile boolean closed;

    SseChunkSource(BufferedReader reader, Closeable response, ObjectMapper objectMapper) {
        this.reader = reader;
        this.response = response;
        this.objectMapper = objectMapper;
    }

    @Override
    public ChunkSignal next() {
        if (closed) {
            return ChunkSignal.end();
        }
        try {
            String data = readEvent();
            if (data == null) {
                close();
                return ChunkSignal.end();
            }
            return ChunkSignal.item(objectMapper.readValue(data, GenerateContentChunk.class));
        } catch (IOException ex) {
            close();
            return ChunkSignal.failure(ex);
        }
    }

    private String readEvent() throws IOException {
        StringBuilder data = null;
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isEmpty()) {
                if (data != null) {
                    return data.toString();
                }
                continue;
            }
            if (!line.startsWith(DATA_FIELD)) {
                // comments and event/id/retry fields
                continue;
            }
            String value = line.substring(DATA_FIELD.length());
            if (value.startsWith(" ")) {
                value = value.substring(1);
            }
            if (data == null) {
                data = new StringBuilder(value);
            } else {
                data.append('\n').append(value);
            }
        }
        return data != null ? data.toString() : null;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            response.close();
        } catch (IOException ex) {
            LOGGER.debug("Failed to close response stream", ex);
        }
    }
}
