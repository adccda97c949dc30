package com.rotalog.actor;

/**
 * Base of the unchecked failures raised by or about an actor. Carries the ID of the
 * actor involved so that a failure seen by a caller can be traced to the actor's log.
 */
public class ActorException extends RuntimeException {

    private final String actorId;

    public ActorException(String message, String actorId) {
        super(message);
        this.actorId = actorId;
    }

    public ActorException(String message, Throwable cause, String actorId) {
        super(message, cause);
        this.actorId = actorId;
    }

    /**
     * @return the actor involved, may be null
     */
    public String getActorId() {
        return actorId;
    }
}
