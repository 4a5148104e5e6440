package com.marketsim.core.agent;

import com.marketsim.api.Fill;
import com.marketsim.api.OrderValidationException;
import com.marketsim.core.InvariantViolationException;
import com.marketsim.core.Seeds;
import com.marketsim.core.SimulationConfig;
import com.marketsim.core.execution.ExecutionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * <b>One symbol's agents.</b>
 * <p>
 * Each tick every agent, in ascending id order, decides against the same
 * context and its actions are applied immediately, before the next agent
 * decides. An agent that throws, or asks for an order the engine refuses,
 * loses the rest of its turn; the others are unaffected. A broken book
 * invariant is not an agent failure and propagates.
 * </p>
 */
public class AgentPopulation {

    private static final Logger log = LoggerFactory.getLogger(AgentPopulation.class);

    private final String symbol;
    private final List<TradingAgent> agents;
    private final Map<String, TradingAgent> byOwner = new HashMap<>();
    private long failedDecisions;

    public AgentPopulation(String symbol, List<TradingAgent> agents) {
        this.symbol = symbol;
        List<TradingAgent> sorted = new ArrayList<>(agents);
        sorted.sort(Comparator.comparingInt(TradingAgent::id));
        this.agents = Collections.unmodifiableList(sorted);
        for (TradingAgent agent : sorted) {
            if (byOwner.put(agent.ownerId(), agent) != null) {
                throw new IllegalArgumentException("duplicate agent owner id " + agent.ownerId());
            }
        }
    }

    /**
     * Builds the configured population: makers first, then noise, informed and
     * momentum traders, with ids counting up from 1. Each agent gets its own
     * {@link Random} seeded from (seed, symbol, id).
     */
    public static AgentPopulation create(String symbol, SimulationConfig config) {
        List<TradingAgent> agents = new ArrayList<>();
        int id = 1;
        for (AgentType type : AgentType.values()) {
            for (int i = 0; i < type.count(config); i++, id++) {
                agents.add(type.create(id, symbol, config, new Random(Seeds.derive(config.seed(), symbol, id))));
            }
        }
        return new AgentPopulation(symbol, agents);
    }

    public void runTick(AgentContext context, ExecutionEngine engine) {
        for (TradingAgent agent : agents) {
            List<AgentAction> actions;
            try {
                actions = agent.decide(context);
            } catch (InvariantViolationException e) {
                throw e;
            } catch (RuntimeException e) {
                failedDecisions++;
                log.warn("{} agent {} skipped tick {}: {}", symbol, agent.ownerId(), context.tick(), e.toString());
                continue;
            }
            apply(agent, actions, context, engine);
        }
    }

    private void apply(TradingAgent agent, List<AgentAction> actions, AgentContext context, ExecutionEngine engine) {
        for (AgentAction action : actions) {
            try {
                if (action.kind() == AgentAction.Kind.SUBMIT) {
                    long orderId = engine.submit(action.request(), context.timestamp());
                    agent.onSubmitted(action.request(), orderId);
                } else {
                    engine.cancel(action.orderId());
                }
            } catch (OrderValidationException e) {
                failedDecisions++;
                log.warn("{} agent {} action {} refused: {}", symbol, agent.ownerId(), action, e.getMessage());
                return;
            }
        }
    }

    /**
     * Routes a fill to the agent that owns the order, if any.
     */
    public void onFill(Fill fill) {
        TradingAgent agent = byOwner.get(fill.ownerId());
        if (agent != null) {
            agent.onFill(fill);
        }
    }

    public List<TradingAgent> agents() {
        return agents;
    }

    public TradingAgent byOwnerId(String ownerId) {
        return byOwner.get(ownerId);
    }

    public int size() {
        return agents.size();
    }

    public long failedDecisions() {
        return failedDecisions;
    }
}
