package com.rotalog.actor;

/**
 * Lifecycle of an {@link Actor}.
 * Transitions only move forward: {@code STARTING -> RUNNING -> DRAINING -> CLOSED}.
 * An actor may skip straight to {@code CLOSED} when it fails fatally.
 */
public enum ActorState {
    /** Thread created, {@code preStart} not finished yet. Messages are queued. */
    STARTING,
    /** Servicing both channels. */
    RUNNING,
    /** Shutting down: no new messages or commands are accepted, buffered messages are flushed. */
    DRAINING,
    /** Terminal. */
    CLOSED;

    /**
     * @return true while sends to the actor are still queued rather than dropped
     */
    public boolean isAccepting() {
        return this == STARTING || this == RUNNING;
    }
}
