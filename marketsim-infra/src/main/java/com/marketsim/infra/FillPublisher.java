package com.marketsim.infra;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.EventTranslatorOneArg;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.marketsim.api.Fill;
import org.agrona.concurrent.BackoffIdleStrategy;
import org.agrona.concurrent.IdleStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * <b>Fill Publisher: Getting Fills Off the Matching Thread.</b>
 * <p>
 * Lanes publish every fill into one multi-producer ring; a single consumer
 * thread hands each fill to the configured {@link FillSink}s in order. Sinks
 * may do I/O (journal, network) without ever stalling a lane, unless the ring
 * fills up, in which case lanes wait for space.
 * </p>
 *
 * <pre>
 * [Lane AAPL] --\
 * [Lane MSFT] ----&gt; (Fill Ring Buffer) --&gt; [Publisher thread] --&gt; sinks
 * [Lane ...]  --/
 * </pre>
 */
public class FillPublisher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FillPublisher.class);

    private static final EventTranslatorOneArg<FillEvent, Fill> TRANSLATOR = (event, sequence, fill) -> event.fill = fill;

    private final Disruptor<FillEvent> disruptor;
    private final RingBuffer<FillEvent> ringBuffer;
    private final List<FillSink> sinks;

    private volatile long processedSequence = -1;
    private volatile long sinkFailures;

    public FillPublisher(int ringSize, List<FillSink> sinks) {
        this.sinks = List.copyOf(sinks);
        this.disruptor = new Disruptor<>(
                FillEvent.FACTORY,
                ringSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        this.disruptor.handleEventsWith(new SinkHandler());
        this.ringBuffer = disruptor.start();
    }

    public void publish(Fill fill) {
        ringBuffer.publishEvent(TRANSLATOR, fill);
    }

    /**
     * Waits until every fill published so far has reached the sinks.
     *
     * @return false if the timeout passed first
     */
    public boolean drain(long timeout, TimeUnit unit) {
        long target = ringBuffer.getCursor();
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        IdleStrategy idle = new BackoffIdleStrategy(10, 20, TimeUnit.MICROSECONDS.toNanos(1),
                TimeUnit.MILLISECONDS.toNanos(1));
        while (processedSequence < target) {
            if (System.nanoTime() > deadline) {
                log.warn("Fill ring not drained: at {} of {}", processedSequence, target);
                return false;
            }
            idle.idle();
        }
        return true;
    }

    /**
     * Fills that reached the sinks so far.
     */
    public long processed() {
        return processedSequence + 1;
    }

    public long sinkFailures() {
        return sinkFailures;
    }

    @Override
    public void close() {
        drain(5, TimeUnit.SECONDS);
        disruptor.shutdown();
        for (FillSink sink : sinks) {
            sink.close();
        }
    }

    private class SinkHandler implements EventHandler<FillEvent> {
        @Override
        public void onEvent(FillEvent event, long sequence, boolean endOfBatch) {
            for (FillSink sink : sinks) {
                try {
                    sink.onFill(event.fill);
                } catch (RuntimeException e) {
                    // Remaining sinks still get the fill
                    sinkFailures++;
                    log.error("Fill sink {} failed on {}", sink, event.fill, e);
                }
            }
            event.reset();
            processedSequence = sequence;
        }
    }
}
