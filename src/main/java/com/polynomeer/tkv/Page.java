package com.polynomeer.tkv;

import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * One fetched page: the number of index entries matching the range, and the selected values.
 * Items are wrapped lazily as they are iterated.
 */
public final class Page implements Iterable<PageItem> {
    private final long total;
    private final List<ByteBuffer> values;

    public Page(long total, List<ByteBuffer> values) {
        this.total = total;
        this.values = values;
    }

    public static Page empty(long total) {
        return new Page(total, Collections.emptyList());
    }

    /**
     * Index entries in range at the time of the count; may exceed {@code offset + size()}.
     */
    public long total() {
        return total;
    }

    public int size() {
        return values.size();
    }

    @Override
    public Iterator<PageItem> iterator() {
        Iterator<ByteBuffer> it = values.iterator();
        return new Iterator<PageItem>() {
            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public PageItem next() {
                return PageItem.of(Payload.of(it.next()));
            }
        };
    }
}
