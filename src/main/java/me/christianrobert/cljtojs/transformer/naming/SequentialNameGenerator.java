package me.christianrobert.cljtojs.transformer.naming;

import java.util.regex.Pattern;

/**
 * Counter-based {@link NameGenerator}.
 *
 * <p>Names have the shape {@code tag$n} where {@code n} increases by one per call,
 * starting at 1. That shape is reserved: source symbols ending in {@code $} followed
 * by digits are refused by the translator. Not thread-safe.</p>
 */
public class SequentialNameGenerator implements NameGenerator {

    static final String SEPARATOR = "$";

    private static final Pattern RESERVED = Pattern.compile("^.+\\$[0-9]+$");

    private long counter;

    public SequentialNameGenerator() {
        this(0);
    }

    /**
     * @param start Last value already used; the first name gets {@code start + 1}
     */
    public SequentialNameGenerator(long start) {
        if (start < 0) {
            throw new IllegalArgumentException("Counter start cannot be negative");
        }
        this.counter = start;
    }

    @Override
    public String freshName(String tag) {
        if (tag == null || tag.trim().isEmpty()) {
            throw new IllegalArgumentException("Name tag cannot be null or empty");
        }
        counter++;
        return tag + SEPARATOR + counter;
    }

    @Override
    public boolean isReserved(String name) {
        return name != null && RESERVED.matcher(name).matches();
    }

    /**
     * Number of names allocated so far.
     */
    public long getAllocatedCount() {
        return counter;
    }
}
