/**
 * Periodic removal of expired and old queue items.
 */
package siorgsync.cleanup;
