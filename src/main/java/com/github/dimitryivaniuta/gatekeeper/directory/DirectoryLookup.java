package com.github.dimitryivaniuta.gatekeeper.directory;

/**
 * Read-only allow-list queries used by the authorizers.
 */
public interface DirectoryLookup {

    /**
     * @throws DirectoryUnavailableException if the directory cannot be reached in time
     */
    LookupOutcome ipAddressStatus(String ipAddress);

    /**
     * @param rawToken the credential exactly as presented by the caller
     * @throws DirectoryUnavailableException if the directory cannot be reached in time
     */
    LookupOutcome tokenStatus(String rawToken);
}
