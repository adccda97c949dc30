package com.rotalog.config;

/**
 * Supplies the logger's configuration. Called once at start and again on every reload.
 * <p>
 * Implementations do not fail on a missing or invalid configuration: they report the
 * problem and fall back to defaults, field by field where possible.
 */
@FunctionalInterface
public interface LogConfigSource {

    /**
     * @return a configuration the caller may modify
     */
    LogConfig load();

    /**
     * @return a source that always supplies a copy of the given configuration
     */
    static LogConfigSource fixed(LogConfig config) {
        LogConfig snapshot = config.copy();
        return snapshot::copy;
    }
}
