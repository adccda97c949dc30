package com.rotalog.actor;

/**
 * An actor failure that cannot be recovered from within the process.
 * <p>
 * Raising one of these is never followed by a retry. Whoever catches it escalates to
 * {@link ProcessTerminator#abort(String, Throwable)}.
 */
public class FatalActorException extends ActorException {

    public FatalActorException(String message, String actorId) {
        super(message, actorId);
    }

    public FatalActorException(String message, Throwable cause, String actorId) {
        super(message, cause, actorId);
    }
}
