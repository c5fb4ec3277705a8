package banstore.spring.boot;

import banstore.BanStore;
import banstore.jdbc.DataSourceConnectionProvider;
import banstore.jdbc.store.AbstractJdbcAddressStore;
import banstore.jdbc.store.JdbcAddressStores;
import banstore.spi.AddressStore;
import banstore.spi.ConnectionProvider;
import banstore.spi.MetricsExporter;
import banstore.spi.TxContext;
import banstore.spring.SpringTxContext;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the ban store.
 *
 * <p>Wires a {@link BanStore} from the application {@link DataSource}: the address store
 * is picked from the JDBC URL, and store calls made inside Spring transactions join them.
 *
 * @see BanStoreProperties
 * @see BanStoreMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(BanStore.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(BanStoreProperties.class)
public class BanStoreAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(AddressStore.class)
  public AbstractJdbcAddressStore addressStore(DataSource dataSource, BanStoreProperties props) {
    return JdbcAddressStores.detect(dataSource, props.getTableName());
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(TxContext.class)
  public SpringTxContext txContext(DataSource dataSource) {
    return new SpringTxContext(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public BanStore banStore(BanStoreProperties props,
      ConnectionProvider connectionProvider,
      TxContext txContext,
      AddressStore addressStore,
      ObjectProvider<MetricsExporter> metricsProvider) {
    var builder = BanStore.builder()
        .connectionProvider(connectionProvider)
        .txContext(txContext)
        .addressStore(addressStore)
        .initializeSchema(props.isInitializeSchema());
    if (props.getIsolation() != null) {
      builder.isolationLevel(props.getIsolation().level());
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }
}
