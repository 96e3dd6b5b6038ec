package com.polynomeer.tkv.client;

import com.polynomeer.tkv.resp.RespReader;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AbstractStoreClientTest {

    /**
     * Answers every frame with the same canned reply.
     */
    private static AbstractStoreClient replying(Object reply) {
        return new AbstractStoreClient() {
            @Override
            protected List<Object> roundTrip(List<List<byte[]>> frames) {
                return Collections.nCopies(frames.size(), reply);
            }

            @Override
            public void close() {
            }
        };
    }

    private static ByteBuffer bulk(String s) {
        return ByteBuffer.wrap(s.getBytes(StandardCharsets.UTF_8)).asReadOnlyBuffer();
    }

    @Test
    void well_typed_replies_are_decoded() {
        assertEquals(3L, replying(3L).zcount("z", "-inf", "+inf"));
        assertEquals(1.5, replying(bulk("1.5")).zscore("z", "m"));
        assertNull(replying(RespReader.NIL).get("k"));
        assertEquals("PONG", replying("PONG").ping());
    }

    @Test
    void mistyped_replies_fail_as_client_errors() {
        var e = assertThrows(StoreClientException.class, () -> replying(bulk("3")).zcount("z", "-inf", "+inf"));
        assertTrue(e.getMessage().startsWith("ZCOUNT: unexpected reply"), e.getMessage());

        assertThrows(StoreClientException.class, () -> replying(7L).get("k"));
        assertThrows(StoreClientException.class, () -> replying(7L).mget(List.of("a")));
        assertThrows(StoreClientException.class, () -> replying(List.of(7L)).mget(List.of("a")));
        assertThrows(StoreClientException.class, () -> replying(List.of(7L)).zrangeByScore("z", "0", "1", 0, 1));
        assertThrows(StoreClientException.class, () -> replying(RespReader.NIL).exists("k"));
        assertThrows(StoreClientException.class, () -> replying(bulk("x")).zscore("z", "m"));
        assertThrows(StoreClientException.class, () -> replying(5L).scriptLoad("return 1"));
    }
}
