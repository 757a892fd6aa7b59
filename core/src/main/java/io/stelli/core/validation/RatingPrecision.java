package io.stelli.core.validation;

import java.util.Arrays;
import java.util.Optional;

/** Decimal precision a rating value may carry. */
public enum RatingPrecision {
    /** Any finite value. */
    ANY("any"),
    /** At most one digit after the decimal point. */
    ONE_DECIMAL("one-decimal"),
    /** Whole numbers only. */
    INTEGER("integer");

    private static final double EPSILON = 1e-9;

    private final String wireName;

    RatingPrecision(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Whether {@code value} satisfies this precision. */
    public boolean admits(double value) {
        return switch (this) {
            case ANY -> !Double.isNaN(value) && !Double.isInfinite(value);
            case ONE_DECIMAL -> isWhole(value * 10);
            case INTEGER -> isWhole(value);
        };
    }

    public static Optional<RatingPrecision> fromWireName(String name) {
        return Arrays.stream(values()).filter(p -> p.wireName.equals(name)).findFirst();
    }

    private static boolean isWhole(double value) {
        return !Double.isInfinite(value) && Math.abs(value - Math.rint(value)) < EPSILON;
    }
}
