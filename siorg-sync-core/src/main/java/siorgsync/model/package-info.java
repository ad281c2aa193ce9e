/**
 * Sync queue data model: queue rows, statuses, entity kinds and local record snapshots.
 */
package siorgsync.model;
