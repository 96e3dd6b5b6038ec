package com.polynomeer.tkv.db;

import com.polynomeer.tkv.struct.ScoredSortedSet;

/**
 * Value stored in the keyspace: either a string or a sorted set.
 */
final class Record {
    enum Type {STR, ZSET}

    final Type type;
    final String strVal;
    final ScoredSortedSet zsetVal;

    private Record(Type type, String strVal, ScoredSortedSet zsetVal) {
        this.type = type;
        this.strVal = strVal;
        this.zsetVal = zsetVal;
    }

    static Record string(String value) {
        return new Record(Type.STR, value, null);
    }

    static Record zset(ScoredSortedSet set) {
        return new Record(Type.ZSET, null, set);
    }
}
