/**
 * JDBC implementation of {@link siorgsync.spi.QueuePurger}.
 */
package siorgsync.jdbc.purge;
