package com.github.dimitryivaniuta.gatekeeper.pipeline;

/**
 * Admission states, in the order a request moves through them.
 * {@link #REJECTED} is terminal and reachable from any state after {@link #ENTERED}.
 */
public enum GatekeeperState {
    ENTERED,
    EDGE_LIMITED,
    HOST_CHECKED,
    IP_CHECKED,
    TOKEN_CHECKED,
    ADMITTED,
    REJECTED
}
