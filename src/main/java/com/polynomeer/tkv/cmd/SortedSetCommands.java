package com.polynomeer.tkv.cmd;

import com.polynomeer.tkv.db.Db;
import com.polynomeer.tkv.db.WrongTypeException;
import com.polynomeer.tkv.resp.RespWriter;
import com.polynomeer.tkv.struct.ScoreRange;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * ZADD / ZREM / ZSCORE / ZCOUNT / ZRANGEBYSCORE / ZRANGE ... BYSCORE.
 * ZADD takes a single score/member pair; that is all the index maintenance needs.
 */
public final class SortedSetCommands {
    private SortedSetCommands() {
    }

    public static void register(Map<String, Command> reg, Db db) {
        reg.put("ZADD", (argv, s) -> guarded(() -> zadd(db, argv)));
        reg.put("ZREM", (argv, s) -> guarded(() -> zrem(db, argv)));
        reg.put("ZSCORE", (argv, s) -> guarded(() -> zscore(db, argv)));
        reg.put("ZCOUNT", (argv, s) -> guarded(() -> zcount(db, argv)));
        reg.put("ZRANGEBYSCORE", (argv, s) -> guarded(() -> zrangeByScore(db, argv)));
        reg.put("ZRANGE", (argv, s) -> guarded(() -> zrange(db, argv)));
    }

    private interface Body {
        ByteBuffer run();
    }

    private static ByteBuffer guarded(Body body) {
        try {
            return body.run();
        } catch (WrongTypeException e) {
            return RespWriter.error(e.getMessage());
        } catch (IllegalArgumentException e) {
            return RespWriter.error("ERR " + e.getMessage());
        }
    }

    private static ByteBuffer zadd(Db db, List<String> argv) {
        if (argv.size() != 4) return RespWriter.error("ERR wrong number of arguments for 'ZADD'");
        double score = ScoreRange.parseScore(argv.get(2));
        return RespWriter.integer(db.zadd(argv.get(1), score, argv.get(3)));
    }

    private static ByteBuffer zrem(Db db, List<String> argv) {
        if (argv.size() < 3) return RespWriter.error("ERR wrong number of arguments for 'ZREM'");
        return RespWriter.integer(db.zrem(argv.get(1), argv.subList(2, argv.size())));
    }

    private static ByteBuffer zscore(Db db, List<String> argv) {
        if (argv.size() != 3) return RespWriter.error("ERR wrong number of arguments for 'ZSCORE'");
        Double score = db.zscore(argv.get(1), argv.get(2));
        return score == null ? RespWriter.nullBulk() : RespWriter.bulkString(ScoreRange.format(score));
    }

    private static ByteBuffer zcount(Db db, List<String> argv) {
        if (argv.size() != 4) return RespWriter.error("ERR wrong number of arguments for 'ZCOUNT'");
        return RespWriter.integer(db.zcount(argv.get(1), ScoreRange.parse(argv.get(2), argv.get(3))));
    }

    // ZRANGEBYSCORE key min max [LIMIT offset count]
    private static ByteBuffer zrangeByScore(Db db, List<String> argv) {
        if (argv.size() < 4) return RespWriter.error("ERR wrong number of arguments for 'ZRANGEBYSCORE'");
        return members(db, argv, 4);
    }

    // ZRANGE key min max BYSCORE [LIMIT offset count]
    private static ByteBuffer zrange(Db db, List<String> argv) {
        if (argv.size() < 5 || !"BYSCORE".equals(argv.get(4).toUpperCase(Locale.ROOT))) {
            return RespWriter.error("ERR ZRANGE is only supported with BYSCORE");
        }
        return members(db, argv, 5);
    }

    private static ByteBuffer members(Db db, List<String> argv, int limitAt) {
        long offset = 0;
        long count = -1;
        if (argv.size() == limitAt + 3 && "LIMIT".equals(argv.get(limitAt).toUpperCase(Locale.ROOT))) {
            try {
                offset = Long.parseLong(argv.get(limitAt + 1));
                count = Long.parseLong(argv.get(limitAt + 2));
            } catch (NumberFormatException e) {
                return RespWriter.error("ERR value is not an integer or out of range");
            }
        } else if (argv.size() != limitAt) {
            return RespWriter.error("ERR syntax error");
        }
        ScoreRange range = ScoreRange.parse(argv.get(2), argv.get(3));
        return RespWriter.arrayOfBulk(db.zrangeByScore(argv.get(1), range, offset, count));
    }
}
