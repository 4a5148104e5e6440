package com.marketsim.infra;

import com.marketsim.api.AnalyticsSnapshot;
import com.marketsim.api.MarketState;
import com.marketsim.api.Result;
import com.marketsim.core.SimulationConfig;
import com.marketsim.infra.journal.ChronicleJournal;
import io.aeron.Aeron;
import io.aeron.driver.MediaDriver;
import io.aeron.driver.ThreadingMode;
import org.agrona.concurrent.SleepingMillisIdleStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs a simulation of a handful of default symbols against the wall clock.
 * <p>
 * Fills are journalled to Chronicle Queue under {@code marketsim.journal.dir}
 * and published on {@code aeron:ipc} stream {@value #FILL_STREAM_ID} through an
 * embedded media driver.
 * </p>
 *
 * <pre>
 * java com.marketsim.infra.SimulatorMain [seconds]
 * </pre>
 */
public final class SimulatorMain {

    private static final Logger log = LoggerFactory.getLogger(SimulatorMain.class);

    static final String FILL_CHANNEL = "aeron:ipc";
    static final int FILL_STREAM_ID = 11;

    static final Map<String, Double> DEFAULT_SYMBOLS = new LinkedHashMap<>();

    static {
        DEFAULT_SYMBOLS.put("AAPL", 150.0);
        DEFAULT_SYMBOLS.put("MSFT", 300.0);
        DEFAULT_SYMBOLS.put("GOOGL", 140.0);
        DEFAULT_SYMBOLS.put("BTCUSDT", 60000.0);
        DEFAULT_SYMBOLS.put("ETHUSDT", 3000.0);
    }

    private SimulatorMain() {
    }

    public static void main(String[] args) throws InterruptedException {
        long seconds = args.length > 0 ? Long.parseLong(args[0]) : 10;
        SimulationConfig config = SimulationConfig.load(SimulationConfig.DEFAULT_RESOURCE);
        String journalDir = System.getProperty("marketsim.journal.dir", "marketsim-journal");
        log.info("Starting simulation for {}s with {}", seconds, config);

        MediaDriver.Context driverContext = new MediaDriver.Context()
                .dirDeleteOnStart(true)
                .dirDeleteOnShutdown(true)
                .threadingMode(ThreadingMode.SHARED)
                .sharedIdleStrategy(new SleepingMillisIdleStrategy(1));

        try (MediaDriver driver = MediaDriver.launchEmbedded(driverContext);
                Aeron aeron = Aeron.connect(new Aeron.Context().aeronDirectoryName(driver.aeronDirectoryName()))) {

            AeronFillEgress egress = new AeronFillEgress(aeron, FILL_CHANNEL, FILL_STREAM_ID);
            MarketSimulator simulator = new MarketSimulator(config, new ChronicleJournal(journalDir), List.of(egress));

            for (Map.Entry<String, Double> symbol : DEFAULT_SYMBOLS.entrySet()) {
                Result<Void> added = simulator.addSymbol(symbol.getKey(), symbol.getValue());
                if (!added.isOk()) {
                    log.error("Cannot add {}: {}", symbol.getKey(), added);
                }
            }

            CountDownLatch finished = new CountDownLatch(1);
            CountDownLatch closed = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                finished.countDown();
                try {
                    closed.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "marketsim-shutdown"));

            simulator.start();
            finished.await(seconds, TimeUnit.SECONDS);
            simulator.stop();

            report(simulator);
            log.info("{} fills published, {} sent on {} stream {}, {} dropped", simulator.publishedFills(),
                    egress.sent(), FILL_CHANNEL, FILL_STREAM_ID, egress.dropped());
            log.info("Journal written to {}", journalDir);
            simulator.close();
            closed.countDown();
        }
    }

    private static void report(MarketSimulator simulator) {
        for (String symbol : simulator.symbols()) {
            if (simulator.isHalted(symbol)) {
                log.warn("{} HALTED", symbol);
                continue;
            }
            MarketState state = simulator.getMarketState(symbol).value();
            AnalyticsSnapshot analytics = simulator.getAnalytics(symbol).value();
            log.info("{} price={} vol={} liquidity={} volume={} trades={} spread={} vwap={}", symbol,
                    String.format("%.4f", state.lastPrice()), String.format("%.6f", state.volatility()),
                    String.format("%.1f", state.liquidity()), state.volume(), analytics.tradeCount(),
                    String.format("%.4f", analytics.spread()), String.format("%.4f", analytics.vwap()));
        }
    }
}
