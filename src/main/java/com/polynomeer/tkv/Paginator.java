package com.polynomeer.tkv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Chains page fetches into one lazy sequence.
 */
public final class Paginator {
    private static final Logger log = LoggerFactory.getLogger(Paginator.class);

    private Paginator() {
    }

    /**
     * Fetches the first page eagerly and the rest on demand.
     * <p>
     * If the first page already covers {@code total}, its iterator is returned as is. Otherwise
     * the returned iterator advances {@code offset} by {@code limit} each time a page runs dry and
     * stops once {@code offset >= total}. A failed later fetch is yielded as a single error item,
     * after which the iterator ends. Pages are only fetched from {@code hasNext()}, so a consumer
     * that stops pulling stops the fetching.
     *
     * @throws StoreException if the first page cannot be fetched
     */
    public static Iterator<PageItem> paginate(PageFunction pageFn, Instant from, Instant to, int offset, int limit) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive: " + limit);
        Page first;
        try {
            first = pageFn.fetch(from, to, offset, limit);
        } catch (RuntimeException e) {
            throw new StoreException("fetching first page failed", e);
        }

        if (first.total() <= limit) {
            return first.iterator();
        }
        return new PagingIterator(pageFn, from, to, offset, limit, first);
    }

    private static final class PagingIterator implements Iterator<PageItem> {
        private final PageFunction pageFn;
        private final Instant from;
        private final Instant to;
        private final int limit;
        private int offset;
        private long total;
        private Iterator<PageItem> current;
        private boolean last;

        PagingIterator(PageFunction pageFn, Instant from, Instant to, int offset, int limit, Page first) {
            this.pageFn = pageFn;
            this.from = from;
            this.to = to;
            this.offset = offset;
            this.limit = limit;
            this.total = first.total();
            this.current = first.iterator();
        }

        @Override
        public boolean hasNext() {
            while (!current.hasNext()) {
                if (last) return false;
                offset += limit;
                if (offset >= total) {
                    last = true;
                    return false;
                }
                log.debug("fetching page at offset {} of {}", offset, total);
                try {
                    Page page = pageFn.fetch(from, to, offset, limit);
                    total = page.total();
                    current = page.iterator();
                } catch (RuntimeException e) {
                    last = true;
                    current = Collections.singletonList(
                            PageItem.failure(new StoreException("fetching next page failed", e))).iterator();
                }
            }
            return true;
        }

        @Override
        public PageItem next() {
            if (!hasNext()) throw new NoSuchElementException();
            return current.next();
        }
    }
}
