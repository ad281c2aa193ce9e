package siorgsync.model;

/**
 * Kinds of registry entities mirrored into the local organizational database.
 */
public enum EntityType {
  ORGANIZATION,
  UNIT,
  CATEGORY,
  TYPE;

  /**
   * Categories and unit types are curated locally; registry changes to them are
   * acknowledged but never applied.
   */
  public boolean isLocallyManaged() {
    return this == CATEGORY || this == TYPE;
  }
}
