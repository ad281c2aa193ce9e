/**
 * Conflict detection between remote snapshots and local records.
 */
package siorgsync.reconcile;
