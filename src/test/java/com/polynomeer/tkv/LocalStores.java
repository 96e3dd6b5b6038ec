package com.polynomeer.tkv;

import com.polynomeer.tkv.client.LocalStoreClient;
import com.polynomeer.tkv.cmd.CommandRegistry;
import com.polynomeer.tkv.db.MemoryDb;
import com.polynomeer.tkv.lua.LuaEngine;

/**
 * Fresh in-process backend per test.
 */
final class LocalStores {
    final MemoryDb db = new MemoryDb();
    final LuaEngine lua = new LuaEngine(db, 5_000, 64 * 1024 * 1024, 10_000);
    final CommandRegistry registry = new CommandRegistry(db, lua);
    final LocalStoreClient client = new LocalStoreClient(registry);
}
