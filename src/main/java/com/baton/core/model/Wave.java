package com.baton.core.model;

import java.io.Serializable;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;

/**
 * An ordered batch of work items within an epic: numbered waves {@code 1..N},
 * then {@code eval}, then {@code fix}.
 */
public record Wave(Kind kind, int number) implements Comparable<Wave>, Serializable {

    public static final String LABEL_PREFIX = "wave:";

    public static final Wave EVAL = new Wave(Kind.EVAL, 0);
    public static final Wave FIX = new Wave(Kind.FIX, 0);

    private static final Comparator<Wave> ORDER =
            Comparator.comparing(Wave::kind).thenComparingInt(Wave::number);

    public enum Kind { NUMBERED, EVAL, FIX }

    public Wave {
        if (kind == Kind.NUMBERED && number < 1) {
            throw new IllegalArgumentException("Wave numbers start at 1, got " + number);
        }
        if (kind != Kind.NUMBERED) {
            number = 0;
        }
    }

    public static Wave numbered(int number) {
        return new Wave(Kind.NUMBERED, number);
    }

    public static Optional<Wave> parse(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.startsWith(LABEL_PREFIX)) v = v.substring(LABEL_PREFIX.length());
        switch (v) {
            case "eval":
                return Optional.of(EVAL);
            case "fix":
                return Optional.of(FIX);
            default:
                try {
                    int n = Integer.parseInt(v);
                    return n >= 1 ? Optional.of(numbered(n)) : Optional.empty();
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
        }
    }

    public static Optional<Wave> fromLabel(String label) {
        if (label == null || !label.startsWith(LABEL_PREFIX)) return Optional.empty();
        return parse(label);
    }

    public boolean isNumbered() {
        return kind == Kind.NUMBERED;
    }

    public String label() {
        return LABEL_PREFIX + this;
    }

    @Override
    public int compareTo(Wave other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NUMBERED -> String.valueOf(number);
            case EVAL -> "eval";
            case FIX -> "fix";
        };
    }
}
