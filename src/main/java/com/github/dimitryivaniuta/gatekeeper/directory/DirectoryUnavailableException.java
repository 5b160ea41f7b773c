package com.github.dimitryivaniuta.gatekeeper.directory;

/**
 * The directory could not answer: connection refused, pool acquire timeout, query timeout.
 * Never means "not found".
 */
public class DirectoryUnavailableException extends RuntimeException {

    public DirectoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
