package com.marketsim.api;

/**
 * <b>Side: The Direction of the Order.</b>
 * <p>
 * Represents whether an order is a BUY (Bid) or a SELL (Ask).
 * </p>
 *
 * <p>
 * Each side carries the single byte it is written as on the wire (see
 * {@link FillFlyweight}), so encoders never go through {@code ordinal()}.
 * </p>
 */
public enum Side {
    /** Buy Side (Bid) */
    BUY((byte) 0, 1),

    /** Sell Side (Ask) */
    SELL((byte) 1, -1);

    private final byte code;
    private final int sign;

    Side(byte code, int sign) {
        this.code = code;
        this.sign = sign;
    }

    public byte code() {
        return code;
    }

    /**
     * @return +1 for BUY, -1 for SELL. Used to sign order flow and price impact.
     */
    public int sign() {
        return sign;
    }

    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }

    public static Side fromCode(byte code) {
        switch (code) {
            case 0:
                return BUY;
            case 1:
                return SELL;
            default:
                throw new IllegalArgumentException("Unknown side code: " + code);
        }
    }
}
