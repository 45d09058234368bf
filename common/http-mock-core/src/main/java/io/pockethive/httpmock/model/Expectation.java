package io.pockethive.httpmock.model;

/**
 * Inclusive call-count range a rule must fall into when it is verified.
 */
public record Expectation(long min, long max) {

    public static final long UNBOUNDED = Long.MAX_VALUE;

    private static final Expectation ANY = new Expectation(0, UNBOUNDED);

    public Expectation {
        if (min < 0) {
            throw new IllegalArgumentException("min must not be negative: " + min);
        }
        if (max < min) {
            throw new IllegalArgumentException("max (" + max + ") must not be lower than min (" + min + ")");
        }
    }

    /**
     * No constraint; the default for rules that do not declare one.
     */
    public static Expectation any() {
        return ANY;
    }

    public static Expectation exactly(long count) {
        return new Expectation(count, count);
    }

    public static Expectation once() {
        return exactly(1);
    }

    public static Expectation never() {
        return exactly(0);
    }

    public static Expectation atLeast(long count) {
        return new Expectation(count, UNBOUNDED);
    }

    public static Expectation atMost(long count) {
        return new Expectation(0, count);
    }

    public static Expectation between(long min, long max) {
        return new Expectation(min, max);
    }

    public boolean isUnbounded() {
        return max == UNBOUNDED;
    }

    public boolean contains(long count) {
        return count >= min && count <= max;
    }

    @Override
    public String toString() {
        return "[" + min + ", " + (isUnbounded() ? "unbounded" : Long.toString(max)) + "]";
    }
}
