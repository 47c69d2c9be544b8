package dev.pekelund.genai.client;

import java.util.List;

/**
 * One page of a list call plus the token for the next page, empty on the last page.
 */
public record Page<T>(List<T> items, String nextPageToken) {

    public Page {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public boolean hasNextPage() {
        return nextPageToken != null && !nextPageToken.isEmpty();
    }
}
