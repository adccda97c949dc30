package com.rotalog.fileset;

import com.rotalog.actor.FatalActorException;

/**
 * A filesystem operation on a managed log file failed.
 * Durability of later records cannot be guaranteed, so this is fatal.
 */
public class LogFileException extends FatalActorException {

    public LogFileException(String message, Throwable cause, String actorId) {
        super(message, cause, actorId);
    }
}
