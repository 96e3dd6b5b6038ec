package com.polynomeer.tkv.db;

import com.polynomeer.tkv.struct.ScoreRange;

import java.util.List;

/**
 * Keyspace used by the command engine.
 * Not synchronized; all methods are expected to be called while holding the engine monitor.
 */
public interface Db {

    /**
     * Get string value or null if not exists.
     * Throws WrongTypeException if key holds a sorted set.
     */
    String getString(String key) throws WrongTypeException;

    /**
     * Set string value, replacing whatever the key held.
     */
    void setString(String key, String value);

    /**
     * Delete key; returns true if key existed.
     */
    boolean del(String key);

    /**
     * Returns true if key exists.
     */
    boolean exists(String key);

    // ----- Sorted set operations -----

    /**
     * ZADD key score member: returns 1 if the member was added, 0 if its score was updated.
     * Creates the sorted set if it does not exist.
     */
    int zadd(String key, double score, String member) throws WrongTypeException;

    /**
     * ZREM key member [member ...]: returns number of members removed.
     * If the set becomes empty, the key is removed.
     */
    int zrem(String key, List<String> members) throws WrongTypeException;

    /**
     * ZSCORE key member: score or null if member or key missing.
     */
    Double zscore(String key, String member) throws WrongTypeException;

    /**
     * ZCOUNT key min max.
     */
    long zcount(String key, ScoreRange range) throws WrongTypeException;

    /**
     * ZRANGEBYSCORE key min max LIMIT offset count. Negative count returns every match.
     */
    List<String> zrangeByScore(String key, ScoreRange range, long offset, long count) throws WrongTypeException;
}
