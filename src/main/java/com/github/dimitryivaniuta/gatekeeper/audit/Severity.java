package com.github.dimitryivaniuta.gatekeeper.audit;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL
}
