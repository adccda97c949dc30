package com.rotalog.actor;

/**
 * Thrown when a reply is requested from an actor that has already shut down.
 */
public class ActorClosedException extends IllegalStateException {

    private final String actorId;

    public ActorClosedException(String actorId) {
        super("Actor " + actorId + " is closed");
        this.actorId = actorId;
    }

    public String getActorId() {
        return actorId;
    }
}
