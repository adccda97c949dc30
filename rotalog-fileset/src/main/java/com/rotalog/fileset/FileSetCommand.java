package com.rotalog.fileset;

import java.util.concurrent.CompletableFuture;

/**
 * Control requests understood by {@link FileSet}.
 */
sealed interface FileSetCommand permits FileSetCommand.SetConfig, FileSetCommand.Close {

    CompletableFuture<Void> reply();

    record SetConfig(int maxFiles, long maxFileBytes, CompletableFuture<Void> reply) implements FileSetCommand {
    }

    record Close(CompletableFuture<Void> reply) implements FileSetCommand {
    }
}
