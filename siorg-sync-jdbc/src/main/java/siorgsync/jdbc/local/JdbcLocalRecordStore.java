package siorgsync.jdbc.local;

import siorgsync.jdbc.JdbcTemplate;
import siorgsync.jdbc.TableNames;
import siorgsync.model.EntityType;
import siorgsync.model.LocalRecord;
import siorgsync.spi.LocalRecordStore;
import siorgsync.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link LocalRecordStore} over a single generic table keyed by
 * {@code (entity_type, external_code)}, with the current fields and the sync baseline
 * stored as JSON objects.
 *
 * <p>The SQL ({@code SELECT ... FOR UPDATE}, plain {@code UPDATE}/{@code INSERT}) runs
 * unchanged on H2 and PostgreSQL.
 */
public final class JdbcLocalRecordStore implements LocalRecordStore {
  private static final String COLUMNS = "entity_type, external_code, fields, baseline, last_synced_at, updated_at";

  private final String tableName;
  private final JsonCodec jsonCodec;

  private final JdbcTemplate.RowMapper<LocalRecord> rowMapper;

  public JdbcLocalRecordStore() {
    this(TableNames.DEFAULT_LOCAL_RECORD_TABLE, JsonCodec.getDefault());
  }

  public JdbcLocalRecordStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = rs -> {
      String baseline = rs.getString("baseline");
      return new LocalRecord(
          EntityType.valueOf(rs.getString("entity_type")),
          rs.getString("external_code"),
          this.jsonCodec.parseObject(rs.getString("fields")),
          baseline == null ? null : this.jsonCodec.parseObject(baseline),
          JdbcTemplate.instant(rs, "last_synced_at"),
          JdbcTemplate.instant(rs, "updated_at"));
    };
  }

  @Override
  public Optional<LocalRecord> findForUpdate(Connection conn, EntityType entityType, String externalCode) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName +
        " WHERE entity_type=? AND external_code=? FOR UPDATE";
    return first(JdbcTemplate.query(conn, sql, rowMapper, entityType.name(), externalCode));
  }

  /**
   * Reads the local record without locking it.
   */
  public Optional<LocalRecord> find(Connection conn, EntityType entityType, String externalCode) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE entity_type=? AND external_code=?";
    return first(JdbcTemplate.query(conn, sql, rowMapper, entityType.name(), externalCode));
  }

  @Override
  public void apply(Connection conn, EntityType entityType, String externalCode,
      Map<String, Object> changes, Map<String, Object> baseline, Instant syncedAt) {
    Instant syncedMs = syncedAt.truncatedTo(ChronoUnit.MILLIS);
    Optional<LocalRecord> existing = findForUpdate(conn, entityType, externalCode);
    if (existing.isEmpty()) {
      insert(conn, entityType, externalCode, changes, baseline, syncedMs);
      return;
    }
    Map<String, Object> fields = new LinkedHashMap<>(existing.get().fields());
    fields.putAll(changes);
    Map<String, Object> newBaseline = existing.get().hasBaseline()
        ? new LinkedHashMap<>(existing.get().baseline())
        : new LinkedHashMap<>();
    newBaseline.putAll(baseline);
    String sql = "UPDATE " + tableName +
        " SET fields=?, baseline=?, last_synced_at=?, updated_at=? WHERE entity_type=? AND external_code=?";
    JdbcTemplate.update(conn, sql,
        jsonCodec.toJson(fields), jsonCodec.toJson(newBaseline), syncedMs, syncedMs,
        entityType.name(), externalCode);
  }

  /**
   * Records a local edit: writes {@code changes} over the current fields without touching
   * the baseline, creating an unsynced record when none exists. Edits made this way are
   * what the reconciler sees as local modifications.
   */
  public void editFields(Connection conn, EntityType entityType, String externalCode,
      Map<String, Object> changes, Instant now) {
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    Optional<LocalRecord> existing = findForUpdate(conn, entityType, externalCode);
    if (existing.isEmpty()) {
      insert(conn, entityType, externalCode, changes, null, null, nowMs);
      return;
    }
    Map<String, Object> fields = new LinkedHashMap<>(existing.get().fields());
    fields.putAll(changes);
    String sql = "UPDATE " + tableName + " SET fields=?, updated_at=? WHERE entity_type=? AND external_code=?";
    JdbcTemplate.update(conn, sql, jsonCodec.toJson(fields), nowMs, entityType.name(), externalCode);
  }

  private void insert(Connection conn, EntityType entityType, String externalCode,
      Map<String, Object> fields, Map<String, Object> baseline, Instant syncedAt) {
    insert(conn, entityType, externalCode, fields, baseline, syncedAt, syncedAt);
  }

  private void insert(Connection conn, EntityType entityType, String externalCode,
      Map<String, Object> fields, Map<String, Object> baseline, Instant syncedAt, Instant updatedAt) {
    String sql = "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        entityType.name(), externalCode, jsonCodec.toJson(fields),
        baseline == null ? null : jsonCodec.toJson(baseline), syncedAt, updatedAt);
  }

  private static Optional<LocalRecord> first(List<LocalRecord> rows) {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }
}
