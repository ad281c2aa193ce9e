/**
 * The sync worker: poll loop, per-item pipeline, failure classification and retry
 * backoff.
 *
 * @see siorgsync.worker.SyncWorker
 */
package siorgsync.worker;
