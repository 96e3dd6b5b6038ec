package com.polynomeer.tkv.client;

import com.polynomeer.tkv.cmd.CommandRegistry;
import com.polynomeer.tkv.cmd.Session;
import com.polynomeer.tkv.resp.RespError;
import com.polynomeer.tkv.resp.RespReader;
import com.polynomeer.tkv.resp.RespWriter;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * In-process client: hands frames straight to a {@link CommandRegistry} and decodes the encoded
 * replies, without a socket. Thread-safe; the registry serializes commands.
 */
public final class LocalStoreClient extends AbstractStoreClient {
    private final CommandRegistry registry;
    private final RespReader reader = new RespReader();

    public LocalStoreClient(CommandRegistry registry) {
        this.registry = registry;
    }

    @Override
    protected List<Object> roundTrip(List<List<byte[]>> frames) {
        Session session = new Session();
        List<Object> replies = new ArrayList<>(frames.size());
        for (List<byte[]> frame : frames) {
            List<String> argv = new ArrayList<>(frame.size());
            for (byte[] b : frame) argv.add(new String(b, RespWriter.CHARSET));
            ByteBuffer encoded = registry.dispatch(argv, session);
            Object reply;
            try {
                reply = reader.tryReadReply(encoded);
            } catch (RespError e) {
                throw new StoreClientException(argv.get(0) + ": malformed reply", e);
            }
            if (reply == null) throw new StoreClientException(argv.get(0) + ": incomplete reply");
            replies.add(reply);
        }
        return replies;
    }

    @Override
    public void close() {
        // nothing to release
    }
}
