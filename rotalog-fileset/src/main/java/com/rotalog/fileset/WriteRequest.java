package com.rotalog.fileset;

import java.util.concurrent.CompletableFuture;

/**
 * Bytes to append to the current log file. The reply carries the number of bytes written.
 */
record WriteRequest(byte[] bytes, CompletableFuture<Integer> reply) {
}
