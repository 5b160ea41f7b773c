package com.github.dimitryivaniuta.gatekeeper.pipeline;

import java.util.List;
import java.util.Map;

/**
 * Result of a full pipeline run.
 *
 * @param state           {@link GatekeeperState#ADMITTED} or {@link GatekeeperState#REJECTED}
 * @param decision        the rejecting gate's decision, or an allow decision when admitted
 * @param rejectedBy      name of the gate that rejected, {@code null} when admitted
 * @param responseHeaders headers collected from every gate that ran, in order
 * @param trail           states visited, starting with {@link GatekeeperState#ENTERED}
 */
public record PipelineOutcome(
        GatekeeperState state,
        GateDecision decision,
        String rejectedBy,
        Map<String, String> responseHeaders,
        List<GatekeeperState> trail
) {
    public PipelineOutcome {
        responseHeaders = Map.copyOf(responseHeaders);
        trail = List.copyOf(trail);
    }

    public boolean admitted() {
        return state == GatekeeperState.ADMITTED;
    }
}
