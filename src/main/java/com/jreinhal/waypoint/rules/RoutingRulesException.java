package com.jreinhal.waypoint.rules;

/**
 * A rule document was rejected. The previously active rules stay in effect.
 */
public class RoutingRulesException extends RuntimeException {

    public RoutingRulesException(String message) {
        super(message);
    }

    public RoutingRulesException(String message, Throwable cause) {
        super(message, cause);
    }
}
