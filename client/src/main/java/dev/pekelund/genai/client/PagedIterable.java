package dev.pekelund.genai.client;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Items of a list call, fetching pages lazily by following {@code nextPageToken}. Each call to
 * {@link #iterator()} starts again from the first page.
 */
public class PagedIterable<T> implements Iterable<T> {

    private final Function<String, Page<T>> pageFetcher;

    /**
     * @param pageFetcher fetches the page for a token; the first page is requested with {@code null}
     */
    public PagedIterable(Function<String, Page<T>> pageFetcher) {
        this.pageFetcher = Objects.requireNonNull(pageFetcher, "pageFetcher");
    }

    @Override
    public Iterator<T> iterator() {
        return new PageIterator();
    }

    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    private final class PageIterator implements Iterator<T> {

        private Iterator<T> current;
        private String nextPageToken;
        private boolean lastPageFetched;

        @Override
        public boolean hasNext() {
            while (current == null || !current.hasNext()) {
                if (lastPageFetched) {
                    return false;
                }
                Page<T> page = pageFetcher.apply(nextPageToken);
                current = page.items().iterator();
                nextPageToken = page.nextPageToken();
                lastPageFetched = !page.hasNextPage();
            }
            return true;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }
    }
}
