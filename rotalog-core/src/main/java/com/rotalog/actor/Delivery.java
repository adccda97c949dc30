package com.rotalog.actor;

/**
 * Outcome of sending a message or command to an actor.
 */
public enum Delivery {
    /** The actor queued the message and will process it. */
    ACCEPTED,
    /** The actor had already begun shutting down; the message was discarded. */
    DROPPED
}
