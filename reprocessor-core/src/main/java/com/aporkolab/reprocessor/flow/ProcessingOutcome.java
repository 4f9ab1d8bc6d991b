package com.aporkolab.reprocessor.flow;

import com.aporkolab.reprocessor.routing.RoutingDecision;

/**
 * Terminal state of handling one record. {@code decision} is null on success.
 */
public record ProcessingOutcome(MainConsumptionFlow.State state, RoutingDecision decision) {

    public static ProcessingOutcome success() {
        return new ProcessingOutcome(MainConsumptionFlow.State.SUCCESS, null);
    }

    public static ProcessingOutcome routed(RoutingDecision decision) {
        return new ProcessingOutcome(MainConsumptionFlow.State.ROUTED, decision);
    }

    public boolean isSuccess() {
        return state == MainConsumptionFlow.State.SUCCESS;
    }
}
