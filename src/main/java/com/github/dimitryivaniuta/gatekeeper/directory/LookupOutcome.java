package com.github.dimitryivaniuta.gatekeeper.directory;

/**
 * Answer to an allow-list membership query. Only {@link #ACTIVE} authorizes.
 */
public enum LookupOutcome {
    ACTIVE,
    INACTIVE,
    NOT_FOUND;

    public boolean authorizes() {
        return this == ACTIVE;
    }

    static LookupOutcome of(AllowListStatus status) {
        return (status == AllowListStatus.ACTIVE) ? ACTIVE : INACTIVE;
    }
}
