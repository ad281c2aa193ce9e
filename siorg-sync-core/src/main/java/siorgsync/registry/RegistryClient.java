package siorgsync.registry;

import siorgsync.model.EntityType;

import java.util.Optional;

/**
 * Read access to the external registry.
 *
 * <p>Implementations must be safe for concurrent use; the worker calls them from several
 * threads at once. No idempotency is assumed: retries are driven by the queue item's own
 * state, never by the client.
 *
 * @see HttpRegistryClient
 */
public interface RegistryClient {

  /**
   * Fetches the current registry snapshot of an entity.
   *
   * @param entityType   the kind of entity
   * @param externalCode the registry's code for the entity
   * @return the record, or empty when the registry does not know the code
   * @throws RegistryUnavailableException on network failures and transient server errors
   * @throws RegistryRejectedException    when the registry rejects the request
   */
  Optional<RemoteRecord> fetch(EntityType entityType, String externalCode) throws RegistryException;

  /**
   * Returns {@code true} when the registry answers its health endpoint.
   */
  default boolean healthCheck() {
    return true;
  }
}
