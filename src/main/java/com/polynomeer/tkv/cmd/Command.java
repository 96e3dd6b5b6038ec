package com.polynomeer.tkv.cmd;

import java.nio.ByteBuffer;
import java.util.List;

/**
 * A command handler: argv[0] is the command name; returns an encoded RESP reply.
 */
@FunctionalInterface
public interface Command {
    ByteBuffer execute(List<String> argv, Session session);
}
