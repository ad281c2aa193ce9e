package siorgsync.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;

/**
 * Picks the sync queue store dialect for a database from its JDBC URL.
 *
 * <p>Candidates are loaded once via {@link ServiceLoader} from
 * {@code META-INF/services/siorgsync.jdbc.store.AbstractJdbcSyncQueueStore}; the first
 * store with a matching URL prefix wins.
 *
 * <pre>{@code
 * AbstractJdbcSyncQueueStore store = JdbcSyncQueueStores.detect(dataSource);
 * }</pre>
 */
public final class JdbcSyncQueueStores {

  private static final List<AbstractJdbcSyncQueueStore> STORES = ServiceLoader
      .load(AbstractJdbcSyncQueueStore.class)
      .stream()
      .map(ServiceLoader.Provider::get)
      .toList();

  private JdbcSyncQueueStores() {
  }

  /**
   * Detects the store from the URL reported by a connection of {@code dataSource}.
   *
   * @throws IllegalStateException    if no connection can be obtained
   * @throws IllegalArgumentException if no store matches the URL
   */
  public static AbstractJdbcSyncQueueStore detect(DataSource dataSource) {
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to read the JDBC URL of the DataSource", e);
    }
    return detect(url);
  }

  /**
   * Detects the store from a JDBC URL, ignoring case.
   *
   * @throws IllegalArgumentException if the URL is empty or no store matches
   */
  public static AbstractJdbcSyncQueueStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcSyncQueueStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }
    List<String> supported = STORES.stream().flatMap(s -> s.jdbcUrlPrefixes().stream()).toList();
    throw new IllegalArgumentException("No sync queue store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + supported);
  }
}
