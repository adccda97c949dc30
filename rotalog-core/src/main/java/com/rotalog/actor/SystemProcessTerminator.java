package com.rotalog.actor;

/**
 * Ends the JVM: {@link System#exit(int)} for a graceful exit, {@link Runtime#halt(int)}
 * for an abort so that no shutdown hook can block on a broken actor.
 * The abort report goes to standard error because the log files can no longer be trusted.
 */
final class SystemProcessTerminator implements ProcessTerminator {

    static final SystemProcessTerminator INSTANCE = new SystemProcessTerminator();

    private SystemProcessTerminator() {
    }

    @Override
    public void exit(int status) {
        System.exit(status);
    }

    @Override
    public void abort(String reason, Throwable cause) {
        System.err.println("FATAL: " + reason);
        if (cause != null) {
            cause.printStackTrace(System.err);
        }
        System.err.flush();
        Runtime.getRuntime().halt(ABORT_STATUS);
    }
}
