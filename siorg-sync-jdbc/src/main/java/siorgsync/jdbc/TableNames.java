package siorgsync.jdbc;

import java.util.Objects;

/**
 * Default table names and the validation applied to custom ones before they are
 * concatenated into SQL.
 */
public final class TableNames {
  public static final String DEFAULT_QUEUE_TABLE = "siorg_sync_queue";
  public static final String DEFAULT_LOCAL_RECORD_TABLE = "siorg_local_record";
  public static final String DEFAULT_HISTORY_TABLE = "siorg_sync_history";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
