package com.marketsim.api;

/**
 * MAKER is the resting order that provided liquidity, TAKER the incoming order
 * that consumed it.
 */
public enum LiquidityRole {
    MAKER((byte) 0),
    TAKER((byte) 1);

    private final byte code;

    LiquidityRole(byte code) {
        this.code = code;
    }

    public byte code() {
        return code;
    }

    public static LiquidityRole fromCode(byte code) {
        return code == 0 ? MAKER : TAKER;
    }
}
