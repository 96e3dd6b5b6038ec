package com.polynomeer.tkv.struct;

/**
 * Score interval in Redis notation: "-inf", "+inf", "(x" for exclusive, "x" for inclusive.
 */
public final class ScoreRange {
    private final double min;
    private final boolean minExclusive;
    private final double max;
    private final boolean maxExclusive;

    public ScoreRange(double min, boolean minExclusive, double max, boolean maxExclusive) {
        this.min = min;
        this.minExclusive = minExclusive;
        this.max = max;
        this.maxExclusive = maxExclusive;
    }

    public static ScoreRange parse(String min, String max) {
        boolean minEx = min.startsWith("(");
        boolean maxEx = max.startsWith("(");
        return new ScoreRange(
                parseBound(minEx ? min.substring(1) : min),
                minEx,
                parseBound(maxEx ? max.substring(1) : max),
                maxEx);
    }

    /**
     * Parses a single score as accepted by ZADD.
     */
    public static double parseScore(String s) {
        return parseBound(s);
    }

    /**
     * Formats a score the way ZSCORE replies: integral values without exponent or fraction.
     */
    public static String format(double score) {
        if (score == Math.rint(score) && Math.abs(score) < 0x1p63) {
            return Long.toString((long) score);
        }
        if (Double.isInfinite(score)) return score > 0 ? "inf" : "-inf";
        return Double.toString(score);
    }

    private static double parseBound(String s) {
        switch (s.toLowerCase()) {
            case "-inf":
                return Double.NEGATIVE_INFINITY;
            case "+inf":
            case "inf":
                return Double.POSITIVE_INFINITY;
            default:
                double v;
                try {
                    v = Double.parseDouble(s);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("min or max is not a float");
                }
                if (Double.isNaN(v)) throw new IllegalArgumentException("min or max is not a float");
                return v;
        }
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    public boolean isEmpty() {
        return min > max || (min == max && (minExclusive || maxExclusive));
    }

    public boolean aboveMin(double score) {
        return minExclusive ? score > min : score >= min;
    }

    public boolean belowMax(double score) {
        return maxExclusive ? score < max : score <= max;
    }

    public boolean contains(double score) {
        return aboveMin(score) && belowMax(score);
    }
}
