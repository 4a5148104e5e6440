package com.marketsim.infra;

import com.marketsim.api.Fill;
import com.marketsim.api.FillFlyweight;
import io.aeron.Aeron;
import io.aeron.Publication;
import org.agrona.concurrent.UnsafeBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;

/**
 * <b>The Egress Gateway: Publishing Fills.</b>
 * <p>
 * A {@link FillSink} that puts every fill on an Aeron publication, encoded
 * with the {@link FillFlyweight}.
 * </p>
 *
 * <h3>Design:</h3>
 * <ol>
 * <li><b>Reused Buffer:</b> one pre-allocated {@link UnsafeBuffer}. The fill
 * publisher calls sinks from a single thread, so no message ever allocates a
 * byte array.</li>
 * <li><b>Flyweight Serialization:</b> fields are written straight into the
 * buffer with primitive puts.</li>
 * <li><b>Best effort:</b> with no subscriber connected, or when the
 * publication pushes back, the fill is counted as dropped. The journal is the
 * durable record.</li>
 * </ol>
 */
public class AeronFillEgress implements FillSink {

    private static final Logger log = LoggerFactory.getLogger(AeronFillEgress.class);

    private final Publication publication;
    private final UnsafeBuffer buffer;
    private final FillFlyweight flyweight;

    private long sent;
    private long dropped;

    public AeronFillEgress(Aeron aeron, String channel, int streamId) {
        this.publication = aeron.addPublication(channel, streamId);
        this.buffer = new UnsafeBuffer(ByteBuffer.allocateDirect(FillFlyweight.MAX_LENGTH));
        this.flyweight = new FillFlyweight();
        this.flyweight.wrap(buffer, 0);
        log.info("Fill egress on {} stream {}", channel, streamId);
    }

    @Override
    public void onFill(Fill fill) {
        if (!publication.isConnected()) {
            dropped++;
            return;
        }
        int length = flyweight.encode(fill);
        long result = publication.offer(buffer, 0, length);
        if (result < 0) {
            dropped++;
            log.debug("Fill {} not sent, offer returned {}", fill.fillId(), result);
        } else {
            sent++;
        }
    }

    public boolean isConnected() {
        return publication.isConnected();
    }

    public long sent() {
        return sent;
    }

    public long dropped() {
        return dropped;
    }

    @Override
    public void close() {
        publication.close();
    }
}
