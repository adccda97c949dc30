package com.rotalog;

import com.rotalog.config.LogConfig;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Control requests understood by {@link LoggerActor}.
 */
sealed interface LoggerCommand permits LoggerCommand.Exit, LoggerCommand.Panic, LoggerCommand.SetConfig,
        LoggerCommand.Suppress, LoggerCommand.GetConfig, LoggerCommand.ReloadConfig, LoggerCommand.Close {

    /**
     * Releases a waiting caller after the command failed.
     */
    default void fail(Throwable failure) {
        // Nobody waits on commands without a reply
    }

    record Exit(int status, SourceLocation location, String message, CompletableFuture<Void> done)
            implements LoggerCommand {
        @Override
        public void fail(Throwable failure) {
            done.completeExceptionally(failure);
        }
    }

    record Panic(SourceLocation location, String message, String stackTrace, CompletableFuture<Void> done)
            implements LoggerCommand {
        @Override
        public void fail(Throwable failure) {
            done.completeExceptionally(failure);
        }
    }

    record SetConfig(int maxFiles, long maxFileBytes, Priority priority) implements LoggerCommand {
    }

    record Suppress(Set<String> stems) implements LoggerCommand {
    }

    record GetConfig(CompletableFuture<LogConfig> reply) implements LoggerCommand {
        @Override
        public void fail(Throwable failure) {
            reply.completeExceptionally(failure);
        }
    }

    /** Sent by the reload timer. */
    record ReloadConfig() implements LoggerCommand {
    }

    record Close(CompletableFuture<Void> done) implements LoggerCommand {
        @Override
        public void fail(Throwable failure) {
            done.completeExceptionally(failure);
        }
    }
}
