package com.marketsim.infra.journal;

import com.marketsim.api.Fill;
import com.marketsim.api.LiquidityRole;
import com.marketsim.api.Side;
import net.openhft.chronicle.queue.ChronicleQueue;
import net.openhft.chronicle.queue.ExcerptTailer;
import net.openhft.chronicle.queue.impl.single.SingleChronicleQueueBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * <b>Chronicle Queue Journal.</b>
 * <p>
 * Writes each event as one self-describing binary document in a memory-mapped
 * Chronicle Queue. Writers never format strings for fills: the fields go out as
 * raw int64/float64 values.
 * </p>
 *
 * <pre>
 *   fill  : type, fillId, orderId, symbol, side, qty, price, execPx, ts, role, owner
 *   halt  : type, symbol, tick, reason, state
 *   event : type, name, val
 * </pre>
 *
 * <p>
 * Chronicle hands out one appender per thread, so fills from the publisher
 * thread and halts from lane threads never share an appender.
 * </p>
 */
public class ChronicleJournal implements Journal {

    private static final Logger log = LoggerFactory.getLogger(ChronicleJournal.class);

    static final String FILL = "fill";
    static final String HALT = "halt";
    static final String EVENT = "event";

    private final String path;
    private final ChronicleQueue queue;

    public ChronicleJournal(String path) {
        this.path = path;
        this.queue = SingleChronicleQueueBuilder.binary(path).build();
        log.info("Journal writing to {}", path);
    }

    @Override
    public void recordFill(Fill fill) {
        queue.acquireAppender().writeDocument(w -> w.write("type").text(FILL)
                .write("fillId").int64(fill.fillId())
                .write("orderId").int64(fill.orderId())
                .write("symbol").text(fill.symbol())
                .write("side").text(fill.side().name())
                .write("qty").int64(fill.quantity())
                .write("price").float64(fill.price())
                .write("execPx").float64(fill.executionPrice())
                .write("ts").int64(fill.timestamp())
                .write("role").text(fill.role().name())
                .write("owner").text(fill.ownerId()));
    }

    @Override
    public void recordHalt(String symbol, long tick, String reason, String state) {
        queue.acquireAppender().writeDocument(w -> w.write("type").text(HALT)
                .write("symbol").text(symbol)
                .write("tick").int64(tick)
                .write("reason").text(reason)
                .write("state").text(state));
    }

    @Override
    public void recordEvent(CharSequence event, long value) {
        queue.acquireAppender().writeDocument(w -> w.write("type").text(EVENT)
                .write("name").text(event)
                .write("val").int64(value));
    }

    /**
     * Reads back every fill journalled so far, oldest first.
     */
    public List<Fill> readFills() {
        List<Fill> fills = new ArrayList<>();
        ExcerptTailer tailer = queue.createTailer();
        while (tailer.readDocument(w -> {
            if (!FILL.equals(w.read("type").text())) {
                return;
            }
            long fillId = w.read("fillId").int64();
            long orderId = w.read("orderId").int64();
            String symbol = w.read("symbol").text();
            Side side = Side.valueOf(w.read("side").text());
            long qty = w.read("qty").int64();
            double price = w.read("price").float64();
            double execPx = w.read("execPx").float64();
            long ts = w.read("ts").int64();
            LiquidityRole role = LiquidityRole.valueOf(w.read("role").text());
            String owner = w.read("owner").text();
            fills.add(new Fill(fillId, orderId, symbol, side, qty, price, execPx, ts, role, owner, Double.NaN));
        })) {
            // one document per iteration
        }
        return fills;
    }

    /**
     * Symbols of the halts journalled so far, oldest first.
     */
    public List<String> readHalts() {
        List<String> halts = new ArrayList<>();
        ExcerptTailer tailer = queue.createTailer();
        while (tailer.readDocument(w -> {
            if (HALT.equals(w.read("type").text())) {
                halts.add(w.read("symbol").text());
            }
        })) {
            // one document per iteration
        }
        return halts;
    }

    public String path() {
        return path;
    }

    @Override
    public void close() {
        queue.close();
    }
}
