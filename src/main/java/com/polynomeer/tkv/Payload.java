package com.polynomeer.tkv;

import java.nio.ByteBuffer;

/**
 * A record value as returned by a page fetch.
 * <p>
 * {@link #asReadOnlyBuffer()} borrows the reply buffer without copying; treat it as valid only for
 * the iteration step that produced it. {@link #toByteArray()} returns an owned copy for callers
 * that keep the bytes. A payload is absent when the index pointed at a key whose value was gone.
 */
public final class Payload {
    private static final Payload ABSENT = new Payload(null);

    private final ByteBuffer view;

    private Payload(ByteBuffer view) {
        this.view = view;
    }

    static Payload of(ByteBuffer view) {
        return view == null ? ABSENT : new Payload(view.asReadOnlyBuffer());
    }

    public boolean isPresent() {
        return view != null;
    }

    public ByteBuffer asReadOnlyBuffer() {
        return present().duplicate();
    }

    public byte[] toByteArray() {
        ByteBuffer b = present().duplicate();
        byte[] out = new byte[b.remaining()];
        b.get(out);
        return out;
    }

    public int size() {
        return present().remaining();
    }

    private ByteBuffer present() {
        if (view == null) throw new IllegalStateException("payload is absent");
        return view;
    }
}
