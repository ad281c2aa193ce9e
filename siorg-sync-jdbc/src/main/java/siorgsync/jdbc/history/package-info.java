/**
 * JDBC storage for the sync history audit trail.
 */
package siorgsync.jdbc.history;
