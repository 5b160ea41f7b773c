package com.github.dimitryivaniuta.gatekeeper.directory;

public enum AllowListStatus {
    ACTIVE,
    INACTIVE,
    BANNED
}
