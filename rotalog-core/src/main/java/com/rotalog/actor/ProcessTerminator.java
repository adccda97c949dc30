package com.rotalog.actor;

/**
 * The point through which an actor system ends the process.
 * <p>
 * {@link #exit(int)} is the graceful path: callers use it after the actors have
 * flushed and closed their resources. {@link #abort(String, Throwable)} is the
 * abrupt path for fatal failures, where nothing more can be written safely.
 * Implementations used in production do not return from either method.
 */
public interface ProcessTerminator {

    /** Exit status used by {@link #abort(String, Throwable)} in the default terminator. */
    int ABORT_STATUS = 2;

    /**
     * Terminates the process with the given status.
     *
     * @param status the process exit status
     */
    void exit(int status);

    /**
     * Terminates the process immediately after a fatal failure.
     *
     * @param reason short description of the failure
     * @param cause  the failure, may be null
     */
    void abort(String reason, Throwable cause);

    /**
     * @return the terminator that ends the JVM
     */
    static ProcessTerminator system() {
        return SystemProcessTerminator.INSTANCE;
    }
}
