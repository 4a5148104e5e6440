package com.marketsim.api;

import org.agrona.DirectBuffer;
import org.agrona.MutableDirectBuffer;

/**
 * <b>The Fill Flyweight</b>
 * <p>
 * Binary layout of a fill as it leaves the simulator on the egress stream.
 * Reads and writes go straight to the wrapped buffer; nothing is copied into
 * the flyweight itself, so one instance can be re-wrapped over any number of
 * messages.
 * </p>
 * <b>Layout:</b>
 *
 * <pre>
 *   0        8        16       24       32       40       48   49   50       54
 *   +--------+--------+--------+--------+--------+--------+----+----+--------+-------...
 *   | FillID |OrderID |  Qty   | Price  |ExecPx  |  Time  |Side|Role|SymLen  | Symbol (ASCII)
 *   +--------+--------+--------+--------+--------+--------+----+----+--------+-------...
 * </pre>
 *
 * Prices are IEEE-754 doubles, the symbol is a length-prefixed ASCII string.
 */
public class FillFlyweight {

    public static final int FILL_ID_OFFSET = 0;
    public static final int ORDER_ID_OFFSET = 8;
    public static final int QUANTITY_OFFSET = 16;
    public static final int PRICE_OFFSET = 24;
    public static final int EXECUTION_PRICE_OFFSET = 32;
    public static final int TIMESTAMP_OFFSET = 40;
    public static final int SIDE_OFFSET = 48;
    public static final int ROLE_OFFSET = 49;
    public static final int SYMBOL_OFFSET = 50;

    public static final int HEADER_LENGTH = SYMBOL_OFFSET + 4;
    public static final int MAX_SYMBOL_LENGTH = 32;
    public static final int MAX_LENGTH = HEADER_LENGTH + MAX_SYMBOL_LENGTH;

    private DirectBuffer buffer;
    private int offset;

    public FillFlyweight wrap(DirectBuffer buffer, int offset) {
        this.buffer = buffer;
        this.offset = offset;
        return this;
    }

    /**
     * Writes every field of {@code fill} and returns the encoded length.
     */
    public int encode(Fill fill) {
        if (fill.symbol().length() > MAX_SYMBOL_LENGTH) {
            throw new IllegalArgumentException("symbol longer than " + MAX_SYMBOL_LENGTH + ": " + fill.symbol());
        }
        fillId(fill.fillId());
        orderId(fill.orderId());
        quantity(fill.quantity());
        price(fill.price());
        executionPrice(fill.executionPrice());
        timestamp(fill.timestamp());
        side(fill.side().code());
        role(fill.role().code());
        int symbolLength = mutable().putStringAscii(offset + SYMBOL_OFFSET, fill.symbol());
        return SYMBOL_OFFSET + symbolLength;
    }

    /**
     * Rebuilds a {@link Fill}. Owner id and mid price are not on the wire.
     */
    public Fill decode() {
        return new Fill(fillId(), orderId(), symbol(), Side.fromCode(side()), quantity(), price(), executionPrice(),
                timestamp(), LiquidityRole.fromCode(role()), null, Double.NaN);
    }

    private MutableDirectBuffer mutable() {
        return (MutableDirectBuffer) buffer;
    }

    public void fillId(long id) {
        mutable().putLong(offset + FILL_ID_OFFSET, id);
    }

    public long fillId() {
        return buffer.getLong(offset + FILL_ID_OFFSET);
    }

    public void orderId(long id) {
        mutable().putLong(offset + ORDER_ID_OFFSET, id);
    }

    public long orderId() {
        return buffer.getLong(offset + ORDER_ID_OFFSET);
    }

    public void quantity(long qty) {
        mutable().putLong(offset + QUANTITY_OFFSET, qty);
    }

    public long quantity() {
        return buffer.getLong(offset + QUANTITY_OFFSET);
    }

    public void price(double price) {
        mutable().putDouble(offset + PRICE_OFFSET, price);
    }

    public double price() {
        return buffer.getDouble(offset + PRICE_OFFSET);
    }

    public void executionPrice(double price) {
        mutable().putDouble(offset + EXECUTION_PRICE_OFFSET, price);
    }

    public double executionPrice() {
        return buffer.getDouble(offset + EXECUTION_PRICE_OFFSET);
    }

    public void timestamp(long nanos) {
        mutable().putLong(offset + TIMESTAMP_OFFSET, nanos);
    }

    public long timestamp() {
        return buffer.getLong(offset + TIMESTAMP_OFFSET);
    }

    public void side(byte side) {
        mutable().putByte(offset + SIDE_OFFSET, side);
    }

    public byte side() {
        return buffer.getByte(offset + SIDE_OFFSET);
    }

    public void role(byte role) {
        mutable().putByte(offset + ROLE_OFFSET, role);
    }

    public byte role() {
        return buffer.getByte(offset + ROLE_OFFSET);
    }

    public String symbol() {
        return buffer.getStringAscii(offset + SYMBOL_OFFSET);
    }
}
