/**
 * JDBC storage for local entity copies and their sync baselines.
 */
package siorgsync.jdbc.local;
