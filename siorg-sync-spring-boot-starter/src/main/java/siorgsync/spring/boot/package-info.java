/**
 * Spring Boot auto-configuration for the SIORG sync worker.
 *
 * <p>Add the starter, point {@code spring.datasource} at the database holding
 * {@code siorg_sync_queue}, and a {@link siorgsync.SiorgSync} composite starts with the
 * context. Settings live under {@code siorg.sync.*}.
 */
package siorgsync.spring.boot;
