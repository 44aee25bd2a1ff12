/**
 * Node runtime.
 *
 * <p>{@link io.chunkmesh.runtime.TransferRuntime} is a single-writer actor owning the transfer
 * ledger, delivery router and inbox. Inbound frames, retry ticks and presentation requests are
 * all messages on its executor.
 */
package io.chunkmesh.runtime;
