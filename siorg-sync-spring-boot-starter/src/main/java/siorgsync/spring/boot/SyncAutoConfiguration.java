package siorgsync.spring.boot;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import siorgsync.SiorgSync;
import siorgsync.admin.SyncQueueAdmin;
import siorgsync.jdbc.DataSourceConnectionProvider;
import siorgsync.jdbc.TableNames;
import siorgsync.jdbc.history.JdbcSyncHistoryStore;
import siorgsync.jdbc.local.JdbcLocalRecordStore;
import siorgsync.jdbc.purge.JdbcQueuePurger;
import siorgsync.jdbc.store.AbstractJdbcSyncQueueStore;
import siorgsync.jdbc.store.JdbcSyncQueueStores;
import siorgsync.registry.HttpRegistryClient;
import siorgsync.registry.RegistryClient;
import siorgsync.spi.ConnectionProvider;
import siorgsync.spi.LocalRecordStore;
import siorgsync.spi.MetricsExporter;
import siorgsync.spi.QueuePurger;
import siorgsync.spi.SyncHistoryStore;
import siorgsync.util.JsonCodec;

import javax.sql.DataSource;

/**
 * Auto-configuration for the SIORG sync worker.
 *
 * <p>Wires a {@link SiorgSync} composite from a {@link DataSource} and
 * {@link SyncProperties}. Every collaborator backs off when the application defines its
 * own bean of the same type, so a custom {@link RegistryClient} or
 * {@link LocalRecordStore} replaces the bundled one.
 *
 * @see SyncProperties
 * @see SyncMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, SqlInitializationAutoConfiguration.class})
@ConditionalOnClass(SiorgSync.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(SyncProperties.class)
public class SyncAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcSyncQueueStore syncQueueStore(DataSource dataSource, SyncProperties props) {
    AbstractJdbcSyncQueueStore detected = JdbcSyncQueueStores.detect(dataSource);
    if (!TableNames.DEFAULT_QUEUE_TABLE.equals(props.getTableName())) {
      return detected.withTableName(props.getTableName());
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(LocalRecordStore.class)
  public JdbcLocalRecordStore localRecordStore(SyncProperties props) {
    return new JdbcLocalRecordStore(props.getLocalRecordTableName(), JsonCodec.getDefault());
  }

  @Bean
  @ConditionalOnMissingBean(SyncHistoryStore.class)
  public JdbcSyncHistoryStore syncHistoryStore(SyncProperties props) {
    return new JdbcSyncHistoryStore(props.getHistoryTableName(), JsonCodec.getDefault());
  }

  @Bean
  @ConditionalOnMissingBean(QueuePurger.class)
  public JdbcQueuePurger queuePurger(SyncProperties props) {
    return new JdbcQueuePurger(props.getTableName());
  }

  @Bean
  @ConditionalOnMissingBean(RegistryClient.class)
  public HttpRegistryClient registryClient(SyncProperties props) {
    SyncProperties.Registry registry = props.getRegistry();
    return HttpRegistryClient.builder()
        .baseUrl(registry.getBaseUrl())
        .token(registry.getToken())
        .connectTimeout(registry.getConnectTimeout())
        .requestTimeout(registry.getRequestTimeout())
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public SiorgSync siorgSync(SyncProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcSyncQueueStore syncQueueStore,
      LocalRecordStore localRecordStore,
      SyncHistoryStore syncHistoryStore,
      QueuePurger queuePurger,
      RegistryClient registryClient,
      ObjectProvider<MetricsExporter> metricsProvider) {
    return SiorgSync.builder()
        .connectionProvider(connectionProvider)
        .queueStore(syncQueueStore)
        .localRecordStore(localRecordStore)
        .historyStore(syncHistoryStore)
        .purger(queuePurger)
        .registryClient(registryClient)
        .metrics(metricsProvider.getIfAvailable())
        .config(props.toWorkerConfig())
        .autoStart(props.isAutoStart())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public SyncQueueAdmin syncQueueAdmin(SiorgSync siorgSync) {
    return siorgSync.admin();
  }
}
