package com.rotalog.actor;

import java.time.Duration;

/**
 * Raised by a bounded wait on an actor reply that did not arrive in time.
 * The actor's event loop is assumed to be stuck, so this is fatal.
 */
public class ActorTimeoutException extends FatalActorException {

    private final Duration timeout;

    public ActorTimeoutException(String actorId, String operation, Duration timeout) {
        super("Timeout after " + timeout.toMillis() + " ms waiting for " + actorId + " to " + operation, actorId);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
