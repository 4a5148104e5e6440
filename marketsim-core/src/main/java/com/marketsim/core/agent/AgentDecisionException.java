package com.marketsim.core.agent;

/**
 * An agent could not decide what to do this tick. The agent sits the tick out;
 * the simulation carries on.
 */
public class AgentDecisionException extends RuntimeException {

    public AgentDecisionException(String message) {
        super(message);
    }

    public AgentDecisionException(String message, Throwable cause) {
        super(message, cause);
    }
}
