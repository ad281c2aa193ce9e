/**
 * Sync queue worker for the SIORG organizational registry.
 *
 * <p>Producers enqueue registry changes; {@link siorgsync.worker.SyncWorker} claims them
 * with a lease, validates them against the registry, reconciles them with the local
 * records and records the outcome. {@link siorgsync.SiorgSync} wires the pieces together.
 */
package siorgsync;
