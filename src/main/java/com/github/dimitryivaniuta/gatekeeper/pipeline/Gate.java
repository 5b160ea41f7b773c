package com.github.dimitryivaniuta.gatekeeper.pipeline;

/**
 * One admission check. Implementations resolve their own dependency failures into a decision;
 * an exception escaping {@link #evaluate} is treated as a bug by the pipeline.
 */
public interface Gate {

    /** State the request reaches when this gate lets it through. */
    GatekeeperState passedState();

    /** Short stable name used in metrics tags and audit details, e.g. "host". */
    String name();

    GateDecision evaluate(GateRequest request);
}
