package siorgsync.registry;

import siorgsync.model.EntityType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of an entity as the registry currently reports it.
 *
 * @param entityType   the kind of entity
 * @param externalCode the registry's code for the entity
 * @param fields       field values, in the order the registry returned them
 */
public record RemoteRecord(EntityType entityType, String externalCode, Map<String, Object> fields) {

  public RemoteRecord {
    Objects.requireNonNull(entityType, "entityType");
    Objects.requireNonNull(externalCode, "externalCode");
    fields = fields == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }
}
