package io.trading.marketdata.dbn.model;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Conversions for fixed-point prices at a scale of 1e-9.
 */
public final class FixedPrice {

    /** Sentinel for a null or undefined price. */
    public static final long UNDEF_PRICE = Long.MAX_VALUE;

    /** Number of decimal places in a raw price. */
    public static final int SCALE = 9;

    private FixedPrice() {}

    public static boolean isDefined(long raw) {
        return raw != UNDEF_PRICE;
    }

    /**
     * Converts a raw price to an exact decimal, or empty for the undefined sentinel.
     */
    public static Optional<BigDecimal> toDecimal(long raw) {
        if (raw == UNDEF_PRICE) {
            return Optional.empty();
        }
        return Optional.of(BigDecimal.valueOf(raw, SCALE));
    }

    /**
     * Converts a decimal price to its raw representation. Fails if the value has more
     * than nine decimal places or does not fit in 64 bits.
     */
    public static long fromDecimal(BigDecimal price) {
        if (price == null) {
            throw new IllegalArgumentException("price cannot be null");
        }
        try {
            return price.setScale(SCALE).unscaledValue().longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("price not representable at scale 1e-9: " + price, e);
        }
    }
}
