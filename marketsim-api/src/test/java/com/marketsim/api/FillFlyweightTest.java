package com.marketsim.api;

import org.agrona.concurrent.UnsafeBuffer;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.*;

class FillFlyweightTest {

    @Test
    void shouldWriteFieldsAtFixedOffsets() {
        UnsafeBuffer buffer = new UnsafeBuffer(ByteBuffer.allocateDirect(FillFlyweight.MAX_LENGTH));
        Fill fill = new Fill(7L, 42L, "AAPL", Side.SELL, 150, 100.5, 100.47, 1_000_000L,
                LiquidityRole.TAKER, "agent-3", 100.25);

        int length = new FillFlyweight().wrap(buffer, 0).encode(fill);

        assertEquals(FillFlyweight.HEADER_LENGTH + 4, length);
        assertEquals(42L, buffer.getLong(FillFlyweight.ORDER_ID_OFFSET));
        assertEquals(150L, buffer.getLong(FillFlyweight.QUANTITY_OFFSET));
        assertEquals(100.47, buffer.getDouble(FillFlyweight.EXECUTION_PRICE_OFFSET));
        assertEquals(Side.SELL.code(), buffer.getByte(FillFlyweight.SIDE_OFFSET));
        assertEquals(LiquidityRole.TAKER.code(), buffer.getByte(FillFlyweight.ROLE_OFFSET));
    }

    @Test
    void decodeReadsBackWireFieldsAtAnOffset() {
        UnsafeBuffer buffer = new UnsafeBuffer(new byte[128]);
        Fill fill = new Fill(1L, 2L, "BTCUSDT", Side.BUY, 3, 60000.0, 60000.0, 99L,
                LiquidityRole.MAKER, "mm-1", Double.NaN);

        FillFlyweight flyweight = new FillFlyweight().wrap(buffer, 16);
        flyweight.encode(fill);
        Fill decoded = flyweight.decode();

        assertEquals("BTCUSDT", decoded.symbol());
        assertEquals(Side.BUY, decoded.side());
        assertEquals(LiquidityRole.MAKER, decoded.role());
        assertEquals(60000.0, decoded.price());
        assertEquals(99L, decoded.timestamp());
        assertNull(decoded.ownerId());
    }

    @Test
    void shouldRefuseOverlongSymbols() {
        UnsafeBuffer buffer = new UnsafeBuffer(new byte[256]);
        Fill fill = new Fill(1L, 2L, "X".repeat(FillFlyweight.MAX_SYMBOL_LENGTH + 1), Side.BUY, 1, 1.0, 1.0, 0L,
                LiquidityRole.MAKER, "o", Double.NaN);
        assertThrows(IllegalArgumentException.class, () -> new FillFlyweight().wrap(buffer, 0).encode(fill));
    }
}
