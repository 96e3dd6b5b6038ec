package com.polynomeer.tkv;

/**
 * Element of a page sequence: a payload, or the error that ended the sequence.
 */
public final class PageItem {
    private final Payload payload;
    private final StoreException error;

    private PageItem(Payload payload, StoreException error) {
        this.payload = payload;
        this.error = error;
    }

    public static PageItem of(Payload payload) {
        return new PageItem(payload, null);
    }

    public static PageItem failure(StoreException error) {
        return new PageItem(null, error);
    }

    public boolean isError() {
        return error != null;
    }

    /**
     * @throws StoreException the carried error, if this item is one
     */
    public Payload payload() {
        if (error != null) throw error;
        return payload;
    }

    public StoreException error() {
        return error;
    }
}
