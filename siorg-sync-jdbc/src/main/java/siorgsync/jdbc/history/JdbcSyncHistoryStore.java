package siorgsync.jdbc.history;

import siorgsync.jdbc.JdbcTemplate;
import siorgsync.jdbc.TableNames;
import siorgsync.model.EntityType;
import siorgsync.model.HistorySource;
import siorgsync.model.SyncHistoryEntry;
import siorgsync.spi.SyncHistoryStore;
import siorgsync.util.JsonCodec;

import java.sql.Connection;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * {@link SyncHistoryStore} over an append-only table. Data columns hold JSON objects and
 * {@code affected_fields} a JSON array of field names. The SQL runs unchanged on H2 and
 * PostgreSQL.
 */
public final class JdbcSyncHistoryStore implements SyncHistoryStore {
  private static final String COLUMNS = "id, queue_item_id, entity_type, external_code, change_type, source, " +
      "previous_data, new_data, affected_fields, notes, created_by, created_at";

  private final String tableName;
  private final JsonCodec jsonCodec;

  private final JdbcTemplate.RowMapper<SyncHistoryEntry> rowMapper;

  public JdbcSyncHistoryStore() {
    this(TableNames.DEFAULT_HISTORY_TABLE, JsonCodec.getDefault());
  }

  public JdbcSyncHistoryStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = rs -> {
      String previous = rs.getString("previous_data");
      String next = rs.getString("new_data");
      return new SyncHistoryEntry(
          rs.getString("id"),
          rs.getString("queue_item_id"),
          EntityType.valueOf(rs.getString("entity_type")),
          rs.getString("external_code"),
          rs.getString("change_type"),
          HistorySource.valueOf(rs.getString("source")),
          previous == null ? null : this.jsonCodec.parseObject(previous),
          next == null ? null : this.jsonCodec.parseObject(next),
          this.jsonCodec.parseStringList(rs.getString("affected_fields")),
          rs.getString("notes"),
          rs.getString("created_by"),
          JdbcTemplate.instant(rs, "created_at"));
    };
  }

  @Override
  public void record(Connection conn, SyncHistoryEntry entry) {
    String sql = "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        entry.id(),
        entry.queueItemId(),
        entry.entityType().name(),
        entry.externalCode(),
        entry.changeType(),
        entry.source().name(),
        entry.previousData() == null ? null : jsonCodec.toJson(entry.previousData()),
        entry.newData() == null ? null : jsonCodec.toJson(entry.newData()),
        jsonCodec.toJson(entry.affectedFields()),
        entry.notes(),
        entry.createdBy(),
        entry.createdAt().truncatedTo(ChronoUnit.MILLIS));
  }

  @Override
  public List<SyncHistoryEntry> listForEntity(Connection conn, EntityType entityType, String externalCode,
      int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName +
        " WHERE entity_type=? AND external_code=? ORDER BY created_at DESC, id DESC LIMIT ?";
    return JdbcTemplate.query(conn, sql, rowMapper, entityType.name(), externalCode, limit);
  }
}
