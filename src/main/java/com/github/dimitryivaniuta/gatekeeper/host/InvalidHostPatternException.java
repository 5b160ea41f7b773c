package com.github.dimitryivaniuta.gatekeeper.host;

/**
 * Thrown while building the allowed-host list; aborts startup.
 */
public class InvalidHostPatternException extends IllegalArgumentException {

    public InvalidHostPatternException(String pattern, String reason) {
        super("Invalid allowed-host pattern '" + pattern + "': " + reason);
    }
}
