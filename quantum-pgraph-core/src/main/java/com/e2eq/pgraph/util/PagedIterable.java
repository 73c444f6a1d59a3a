package com.e2eq.pgraph.util;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy iterable over a query that is fetched one page at a time. Each call to
 * {@link #iterator()} starts again from the first row, so the iterable can be consumed
 * more than once. No resources are held between pages.
 *
 * @param <T> element type
 */
public abstract class PagedIterable<T> implements Iterable<T> {

    private final int pageSize;
    private final long maxRows;

    /**
     * @param pageSize rows per fetch
     * @param maxRows  upper bound on rows produced, 0 or less for no bound
     */
    protected PagedIterable(int pageSize, long maxRows) {
        this.pageSize = Math.max(1, pageSize);
        this.maxRows = maxRows;
    }

    /**
     * Fetches at most {@code limit} rows starting at {@code offset}. A page shorter than
     * {@code limit} marks the end.
     */
    protected abstract List<T> fetch(long offset, int limit);

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private List<T> page = List.of();
            private int index;
            private long produced;
            private long offset;
            private boolean exhausted;

            @Override
            public boolean hasNext() {
                if (maxRows > 0 && produced >= maxRows) return false;
                if (index < page.size()) return true;
                if (exhausted) return false;
                int limit = pageSize;
                if (maxRows > 0) limit = (int) Math.min(limit, maxRows - produced);
                page = fetch(offset, limit);
                index = 0;
                offset += page.size();
                if (page.size() < limit) exhausted = true;
                return !page.isEmpty();
            }

            @Override
            public T next() {
                if (!hasNext()) throw new NoSuchElementException();
                produced++;
                return page.get(index++);
            }
        };
    }
}
