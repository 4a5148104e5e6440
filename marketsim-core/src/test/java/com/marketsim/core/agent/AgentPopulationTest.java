package com.marketsim.core.agent;

import com.marketsim.api.BookSnapshot;
import com.marketsim.api.Fill;
import com.marketsim.api.LiquidityRole;
import com.marketsim.api.MarketState;
import com.marketsim.api.OrderRequest;
import com.marketsim.api.Side;
import com.marketsim.core.InvariantViolationException;
import com.marketsim.core.SimulationConfig;
import com.marketsim.core.SymbolEngine;
import com.marketsim.core.book.OrderBook;
import com.marketsim.core.book.PriceScale;
import com.marketsim.core.execution.ExecutionEngine;
import com.marketsim.core.execution.ExecutionListener;
import com.marketsim.core.market.LiquidityModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class AgentPopulationTest {

    private static final String SYMBOL = "TEST";

    private ExecutionEngine engine;
    private OrderBook book;

    @BeforeEach
    void setup() {
        SimulationConfig config = SimulationConfig.defaults();
        book = new OrderBook(SYMBOL, new PriceScale(0.01));
        engine = new ExecutionEngine(SYMBOL, config, book, new LiquidityModel(config), SymbolEngine.idBase(0),
                ExecutionListener.NO_OP);
    }

    private static AgentContext context() {
        MarketState state = new MarketState(SYMBOL, 100.0, 0.001, 0, 10_000, 0, Double.NaN, 1, 0);
        return new AgentContext(SYMBOL, 1, 0, BookSnapshot.empty(SYMBOL), state, 0, 0.01);
    }

    /** Agent whose decision is scripted by the test. */
    private static class ScriptedAgent extends AbstractTradingAgent {
        private final Function<AgentContext, List<AgentAction>> script;
        private final List<Long> submitted = new ArrayList<>();

        ScriptedAgent(int id, Function<AgentContext, List<AgentAction>> script) {
            super(id, SYMBOL, new Random(id));
            this.script = script;
        }

        @Override
        public AgentType type() {
            return AgentType.NOISE;
        }

        @Override
        public List<AgentAction> decide(AgentContext context) {
            return script.apply(context);
        }

        @Override
        public void onSubmitted(OrderRequest request, long orderId) {
            submitted.add(orderId);
        }
    }

    private static AgentAction bid(double price, String owner) {
        return AgentAction.submit(OrderRequest.limit(SYMBOL, Side.BUY, 10, price, owner));
    }

    @Test
    void createsConfiguredMixInIdOrder() {
        AgentPopulation population = AgentPopulation.create(SYMBOL, SimulationConfig.defaults());

        assertEquals(40, population.size());
        for (int i = 0; i < population.size(); i++) {
            assertEquals(i + 1, population.agents().get(i).id());
        }
        assertEquals(AgentType.MARKET_MAKER, population.agents().get(0).type());
        assertEquals(AgentType.MOMENTUM, population.agents().get(39).type());
        assertNotNull(population.byOwnerId("informed-26"));
    }

    @Test
    void agentsActInIdOrder() {
        ScriptedAgent second = new ScriptedAgent(2, c -> List.of(bid(99.0, "noise-2")));
        ScriptedAgent first = new ScriptedAgent(1, c -> List.of(bid(98.0, "noise-1")));
        AgentPopulation population = new AgentPopulation(SYMBOL, List.of(second, first));

        population.runTick(context(), engine);

        assertTrue(first.submitted.get(0) < second.submitted.get(0));
    }

    @Test
    void failingAgentDoesNotStopOthers() {
        ScriptedAgent broken = new ScriptedAgent(1, c -> {
            throw new AgentDecisionException("no view");
        });
        ScriptedAgent healthy = new ScriptedAgent(2, c -> List.of(bid(99.0, "noise-2")));
        AgentPopulation population = new AgentPopulation(SYMBOL, List.of(broken, healthy));

        population.runTick(context(), engine);

        assertEquals(1, population.failedDecisions());
        assertEquals(1, healthy.submitted.size());
        assertEquals(10, book.totalQuantity(Side.BUY));
    }

    @Test
    void refusedOrderEndsThatAgentsTurn() {
        ScriptedAgent agent = new ScriptedAgent(1, c -> List.of(
                AgentAction.submit(OrderRequest.limit("OTHER", Side.BUY, 10, 99.0, "noise-1")),
                bid(98.0, "noise-1")));
        ScriptedAgent next = new ScriptedAgent(2, c -> List.of(bid(97.0, "noise-2")));
        AgentPopulation population = new AgentPopulation(SYMBOL, List.of(agent, next));

        population.runTick(context(), engine);

        assertTrue(agent.submitted.isEmpty());
        assertEquals(1, next.submitted.size());
        assertEquals(1, population.failedDecisions());
    }

    @Test
    void invariantViolationPropagates() {
        ScriptedAgent agent = new ScriptedAgent(1, c -> {
            throw new InvariantViolationException("broken");
        });
        AgentPopulation population = new AgentPopulation(SYMBOL, List.of(agent));

        assertThrows(InvariantViolationException.class, () -> population.runTick(context(), engine));
    }

    @Test
    void fillsGoToOwningAgent() {
        ScriptedAgent agent = new ScriptedAgent(1, c -> List.of());
        AgentPopulation population = new AgentPopulation(SYMBOL, List.of(agent));

        population.onFill(new Fill(1, 1, SYMBOL, Side.BUY, 5, 100.0, 100.0, 0, LiquidityRole.TAKER, "noise-1",
                Double.NaN));
        population.onFill(new Fill(2, 2, SYMBOL, Side.BUY, 5, 100.0, 100.0, 0, LiquidityRole.TAKER, "external",
                Double.NaN));

        assertEquals(5, agent.position());
    }

    @Test
    void duplicateOwnersAreRefused() {
        ScriptedAgent a = new ScriptedAgent(1, c -> List.of());
        ScriptedAgent b = new ScriptedAgent(1, c -> List.of());

        assertThrows(IllegalArgumentException.class, () -> new AgentPopulation(SYMBOL, List.of(a, b)));
    }
}
