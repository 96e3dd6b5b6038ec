package com.polynomeer.tkv.struct;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Sorted set backing ZADD/ZRANGE: a member->score dictionary plus a tree ordered by (score, member).
 * <p>
 * Not thread-safe; callers hold the command engine monitor.
 */
public final class ScoredSortedSet {

    private static final Comparator<Entry> ORDER =
            Comparator.comparingDouble((Entry e) -> e.score).thenComparing(e -> e.member);

    private final Map<String, Double> dict = new HashMap<>();
    private final NavigableSet<Entry> tree = new TreeSet<>(ORDER);

    /**
     * Adds or updates a member. Returns true if the member is new.
     */
    public boolean add(String member, double score) {
        Double prev = dict.put(member, score);
        if (prev != null) {
            if (prev == score) return false;
            tree.remove(new Entry(prev, member));
        }
        tree.add(new Entry(score, member));
        return prev == null;
    }

    public boolean remove(String member) {
        Double prev = dict.remove(member);
        if (prev == null) return false;
        tree.remove(new Entry(prev, member));
        return true;
    }

    public Double score(String member) {
        return dict.get(member);
    }

    public int size() {
        return dict.size();
    }

    public long count(ScoreRange range) {
        if (range.isEmpty()) return 0;
        long n = 0;
        for (Entry e : fromMin(range)) {
            if (!range.belowMax(e.score)) break;
            if (range.aboveMin(e.score)) n++;
        }
        return n;
    }

    /**
     * Members in ascending (score, member) order, skipping {@code offset} matches.
     * A negative count means no limit.
     */
    public List<String> rangeByScore(ScoreRange range, long offset, long count) {
        if (range.isEmpty() || count == 0 || offset < 0) return Collections.emptyList();
        List<String> out = new ArrayList<>();
        long skipped = 0;
        for (Entry e : fromMin(range)) {
            if (!range.belowMax(e.score)) break;
            if (!range.aboveMin(e.score)) continue;
            if (skipped < offset) {
                skipped++;
                continue;
            }
            out.add(e.member);
            if (count > 0 && out.size() >= count) break;
        }
        return out;
    }

    private NavigableSet<Entry> fromMin(ScoreRange range) {
        // "" sorts before every member with the same score
        return tree.tailSet(new Entry(range.min(), ""), true);
    }

    private static final class Entry {
        final double score;
        final String member;

        Entry(double score, String member) {
            this.score = score;
            this.member = member;
        }
    }
}
