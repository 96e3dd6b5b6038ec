package com.polynomeer.tkv.db;

import com.polynomeer.tkv.struct.ScoreRange;
import com.polynomeer.tkv.struct.ScoredSortedSet;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory keyspace holding strings and sorted sets. No TTL.
 * <p>
 * Note: no synchronization; the command engine serializes access.
 */
public class MemoryDb implements Db {

    private final Map<String, Record> map = new HashMap<>();

    @Override
    public String getString(String key) {
        Record r = map.get(key);
        if (r == null) return null;
        if (r.type != Record.Type.STR) throw new WrongTypeException();
        return r.strVal;
    }

    @Override
    public void setString(String key, String value) {
        map.put(key, Record.string(value));
    }

    @Override
    public boolean del(String key) {
        return map.remove(key) != null;
    }

    @Override
    public boolean exists(String key) {
        return map.containsKey(key);
    }

    // ---------- Sorted set operations ----------

    @Override
    public int zadd(String key, double score, String member) {
        Record r = map.get(key);
        if (r == null) {
            r = Record.zset(new ScoredSortedSet());
            map.put(key, r);
        } else if (r.type != Record.Type.ZSET) {
            throw new WrongTypeException();
        }
        return r.zsetVal.add(member, score) ? 1 : 0;
    }

    @Override
    public int zrem(String key, List<String> members) {
        ScoredSortedSet set = zset(key);
        if (set == null) return 0;
        int removed = 0;
        for (String m : members) {
            if (set.remove(m)) removed++;
        }
        if (set.size() == 0) {
            map.remove(key);
        }
        return removed;
    }

    @Override
    public Double zscore(String key, String member) {
        ScoredSortedSet set = zset(key);
        return set == null ? null : set.score(member);
    }

    @Override
    public long zcount(String key, ScoreRange range) {
        ScoredSortedSet set = zset(key);
        return set == null ? 0 : set.count(range);
    }

    @Override
    public List<String> zrangeByScore(String key, ScoreRange range, long offset, long count) {
        ScoredSortedSet set = zset(key);
        if (set == null) return Collections.emptyList();
        return set.rangeByScore(range, offset, count);
    }

    // ---------- helpers ----------

    private ScoredSortedSet zset(String key) {
        Record r = map.get(key);
        if (r == null) return null;
        if (r.type != Record.Type.ZSET) throw new WrongTypeException();
        return r.zsetVal;
    }
}
