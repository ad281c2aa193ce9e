/**
 * Read and mutate operations for operator tooling: listings, statistics, deletes, manual
 * retries and conflict resolution.
 */
package siorgsync.admin;
