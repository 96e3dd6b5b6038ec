package com.polynomeer.tkv;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PaginatorTest {

    private static final List<String> ITEMS = List.of("item1", "item2", "item3", "item4", "item5", "item6");

    private static PageFunction pagesOf(List<String> items, AtomicInteger calls) {
        return (from, to, offset, limit) -> {
            calls.incrementAndGet();
            List<ByteBuffer> values = new ArrayList<>();
            for (int i = offset; i < Math.min(items.size(), offset + limit); i++) {
                values.add(ByteBuffer.wrap(items.get(i).getBytes(StandardCharsets.UTF_8)));
            }
            return new Page(items.size(), values);
        };
    }

    private static List<String> drain(Iterator<PageItem> it) {
        List<String> out = new ArrayList<>();
        while (it.hasNext()) {
            PageItem item = it.next();
            assertFalse(item.isError(), () -> "unexpected error item: " + item.error());
            out.add(new String(item.payload().toByteArray(), StandardCharsets.UTF_8));
        }
        return out;
    }

    @Test
    void yields_all_items_in_order_across_pages() {
        var calls = new AtomicInteger();
        var it = Paginator.paginate(pagesOf(ITEMS, calls), null, null, 0, 2);

        assertEquals(ITEMS, drain(it));
        assertEquals(3, calls.get());
    }

    @Test
    void single_page_when_limit_covers_total() {
        var calls = new AtomicInteger();
        var it = Paginator.paginate(pagesOf(ITEMS, calls), null, null, 0, 6);

        assertEquals(ITEMS, drain(it));
        assertEquals(1, calls.get());
    }

    @Test
    void uneven_last_page() {
        var calls = new AtomicInteger();
        var it = Paginator.paginate(pagesOf(ITEMS, calls), null, null, 0, 4);

        assertEquals(ITEMS, drain(it));
        assertEquals(2, calls.get());
    }

    @Test
    void starting_offset_is_honoured() {
        var calls = new AtomicInteger();
        var it = Paginator.paginate(pagesOf(ITEMS, calls), null, null, 3, 2);

        assertEquals(ITEMS.subList(3, 6), drain(it));
        assertEquals(2, calls.get());
    }

    @Test
    void error_on_first_page_is_thrown_immediately() {
        PageFunction failing = (from, to, offset, limit) -> {
            throw new StoreException("mock error");
        };

        var e = assertThrows(StoreException.class, () -> Paginator.paginate(failing, null, null, 0, 2));
        assertTrue(e.getMessage().contains("fetching first page failed"));
        assertEquals("mock error", e.getCause().getMessage());
    }

    @Test
    void error_on_next_page_is_yielded_once_after_earlier_items() {
        var calls = new AtomicInteger();
        PageFunction pageFn = (from, to, offset, limit) -> {
            calls.incrementAndGet();
            if (offset == 0) {
                return new Page(4, List.of(
                        ByteBuffer.wrap("item1".getBytes(StandardCharsets.UTF_8)),
                        ByteBuffer.wrap("item2".getBytes(StandardCharsets.UTF_8))));
            }
            throw new StoreException("mock error on next page");
        };

        var it = Paginator.paginate(pageFn, null, null, 0, 3);

        List<String> results = new ArrayList<>();
        List<StoreException> errors = new ArrayList<>();
        while (it.hasNext()) {
            PageItem item = it.next();
            if (item.isError()) {
                errors.add(item.error());
            } else {
                results.add(new String(item.payload().toByteArray(), StandardCharsets.UTF_8));
            }
        }

        assertEquals(List.of("item1", "item2"), results);
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).getMessage().contains("fetching next page failed"));
        assertEquals(2, calls.get());
        assertThrows(StoreException.class, () -> PageItem.failure(errors.get(0)).payload());
    }

    @Test
    void early_exit_stops_fetching() {
        var calls = new AtomicInteger();
        var it = Paginator.paginate(pagesOf(ITEMS, calls), null, null, 0, 2);

        // draining the first page fetches nothing more
        for (int i = 0; i < 2; i++) {
            assertTrue(it.hasNext());
            it.next();
        }
        assertEquals(1, calls.get());

        // one item of the second page, then the consumer walks away
        assertTrue(it.hasNext());
        it.next();
        assertEquals(2, calls.get());
    }

    @Test
    void any_runtime_failure_on_a_later_page_becomes_one_error_item() {
        var calls = new AtomicInteger();
        PageFunction pageFn = (from, to, offset, limit) -> {
            if (calls.incrementAndGet() > 1) throw new IllegalStateException("decoder blew up");
            return new Page(4, List.of(ByteBuffer.wrap(new byte[]{1}), ByteBuffer.wrap(new byte[]{2})));
        };

        var it = Paginator.paginate(pageFn, null, null, 0, 2);
        it.next();
        it.next();

        assertTrue(it.hasNext());
        PageItem item = it.next();
        assertTrue(item.isError());
        assertEquals("fetching next page failed", item.error().getMessage());
        assertInstanceOf(IllegalStateException.class, item.error().getCause());
        assertFalse(it.hasNext());
        assertEquals(2, calls.get());
    }

    @Test
    void any_runtime_failure_on_the_first_page_is_wrapped() {
        PageFunction pageFn = (from, to, offset, limit) -> {
            throw new ArithmeticException("long overflow");
        };

        var e = assertThrows(StoreException.class, () -> Paginator.paginate(pageFn, null, null, 0, 2));
        assertEquals("fetching first page failed", e.getMessage());
        assertInstanceOf(ArithmeticException.class, e.getCause());
    }

    @Test
    void page_that_shrank_under_concurrent_delete_moves_on() {
        var calls = new AtomicInteger();
        PageFunction pageFn = (from, to, offset, limit) -> {
            calls.incrementAndGet();
            if (offset == 2) return Page.empty(6); // entries vanished between count and select
            return pagesOf(ITEMS, new AtomicInteger()).fetch(from, to, offset, limit);
        };

        var it = Paginator.paginate(pageFn, null, null, 0, 2);

        assertEquals(List.of("item1", "item2", "item5", "item6"), drain(it));
        assertEquals(3, calls.get());
    }

    @Test
    void rejects_non_positive_limit() {
        assertThrows(IllegalArgumentException.class,
                () -> Paginator.paginate(pagesOf(ITEMS, new AtomicInteger()), null, null, 0, 0));
    }
}
