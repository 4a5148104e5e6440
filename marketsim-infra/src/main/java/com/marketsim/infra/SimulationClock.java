package com.marketsim.infra;

import org.agrona.concurrent.Agent;
import org.agrona.concurrent.NanoClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <b>The Simulation Clock.</b>
 * <p>
 * An Agrona {@link Agent}: its duty cycle fires one simulation tick across all
 * lanes each time the wall-clock interval elapses, and reports no work
 * otherwise so the runner's idle strategy can sleep. Ticks never overlap: the
 * tick barrier returns only once every lane has finished.
 * </p>
 * <p>
 * A clock that falls behind does not try to catch up with a burst of ticks; the
 * next tick is scheduled one interval after the late one.
 * </p>
 */
public class SimulationClock implements Agent {

    private static final Logger log = LoggerFactory.getLogger(SimulationClock.class);

    private final Runnable tickBarrier;
    private final long intervalNanos;
    private final NanoClock nanoClock;

    private long nextTickAt;
    private volatile long ticks;

    /**
     * @param tickBarrier runs one tick on every lane and returns when all are done
     */
    public SimulationClock(Runnable tickBarrier, long intervalNanos, NanoClock nanoClock) {
        this.tickBarrier = tickBarrier;
        this.intervalNanos = intervalNanos;
        this.nanoClock = nanoClock;
    }

    @Override
    public void onStart() {
        nextTickAt = nanoClock.nanoTime();
        log.info("Clock started, one tick every {} ms", intervalNanos / 1_000_000);
    }

    @Override
    public int doWork() {
        long now = nanoClock.nanoTime();
        if (now - nextTickAt < 0) {
            return 0;
        }
        tickBarrier.run();
        ticks++;
        nextTickAt += intervalNanos;
        if (nextTickAt - now <= 0) {
            nextTickAt = now + intervalNanos;
        }
        return 1;
    }

    @Override
    public void onClose() {
        log.info("Clock stopped after {} ticks", ticks);
    }

    @Override
    public String roleName() {
        return "simulation-clock";
    }

    public long ticks() {
        return ticks;
    }
}
