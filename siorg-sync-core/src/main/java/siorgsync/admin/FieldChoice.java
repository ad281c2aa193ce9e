package siorgsync.admin;

/**
 * Which side wins a single conflicting field in a {@link ConflictResolution#MERGE}.
 */
public enum FieldChoice {
  LOCAL,
  REMOTE
}
