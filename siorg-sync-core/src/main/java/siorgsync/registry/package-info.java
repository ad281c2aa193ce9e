/**
 * Client side of the external registry: the {@link siorgsync.registry.RegistryClient}
 * contract the worker depends on, its exception taxonomy, and the HTTP implementation.
 */
package siorgsync.registry;
