package io.meshdispatch.spring.boot;

import io.meshdispatch.DispatchCoordinator;
import io.meshdispatch.DispatchStoreException;
import io.meshdispatch.MeshDispatch;
import io.meshdispatch.geo.NominatimGeocoder;
import io.meshdispatch.jdbc.DataSourceConnectionProvider;
import io.meshdispatch.jdbc.store.AbstractJdbcDispatchStore;
import io.meshdispatch.jdbc.store.JdbcDispatchStores;
import io.meshdispatch.spi.ConnectionProvider;
import io.meshdispatch.spi.Geocoder;
import io.meshdispatch.spi.MetricsExporter;
import io.meshdispatch.spi.Transport;
import io.meshdispatch.transport.TcpTransport;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Auto-configuration for mesh dispatch.
 *
 * <p>Wires a {@link MeshDispatch} composite from a {@link DataSource}, a {@link Transport}
 * and {@link MeshDispatchProperties}. A {@link TcpTransport} is created when
 * {@code meshdispatch.transport.host} is set; otherwise the application supplies its own
 * {@link Transport} bean.
 *
 * @see MeshDispatchProperties
 * @see MeshDispatchMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(MeshDispatch.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(MeshDispatchProperties.class)
public class MeshDispatchAutoConfiguration {
  private static final Logger logger = Logger.getLogger(MeshDispatchAutoConfiguration.class.getName());

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcDispatchStore dispatchStore(DataSource dataSource, MeshDispatchProperties props) {
    AbstractJdbcDispatchStore store = JdbcDispatchStores.detect(dataSource);
    if (props.getSchema().isInitialize()) {
      try (Connection conn = dataSource.getConnection()) {
        store.createSchema(conn);
      } catch (SQLException e) {
        throw new DispatchStoreException("Failed to initialize dispatch schema", e);
      }
      logger.log(Level.INFO, "Initialized dispatch schema for {0}", store.name());
    }
    return store;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(Geocoder.class)
  public NominatimGeocoder geocoder(MeshDispatchProperties props) {
    MeshDispatchProperties.Geocoder g = props.getGeocoder();
    return new NominatimGeocoder(g.getBaseUrl(), g.getUserAgent(), Duration.ofMillis(g.getTimeoutMs()));
  }

  // closed by MeshDispatch
  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean(Transport.class)
  @ConditionalOnProperty(prefix = "meshdispatch.transport", name = "host")
  public TcpTransport tcpTransport(MeshDispatchProperties props) {
    MeshDispatchProperties.Transport t = props.getTransport();
    return TcpTransport.builder()
        .host(t.getHost())
        .port(t.getPort())
        .connectTimeoutMs(t.getConnectTimeoutMs())
        .reconnectBaseDelayMs(t.getReconnectBaseDelayMs())
        .reconnectMaxDelayMs(t.getReconnectMaxDelayMs())
        .sendBufferCapacity(t.getSendBufferCapacity())
        .maxFrameBytes(t.getMaxFrameBytes())
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean(Transport.class)
  public MeshDispatch meshDispatch(MeshDispatchProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcDispatchStore dispatchStore,
      Transport transport,
      Geocoder geocoder,
      ObjectProvider<MetricsExporter> metricsProvider) {
    MeshDispatch.Builder builder = MeshDispatch.builder()
        .connectionProvider(connectionProvider)
        .deliveryStore(dispatchStore.deliveryStore())
        .unitStore(dispatchStore.unitStore())
        .pendingAckStore(dispatchStore.pendingAckStore())
        .transport(transport)
        .geocoder(geocoder)
        .config(props.toDispatchConfig());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    MeshDispatch dispatch = builder.build();
    if (props.isAutoStart()) {
      dispatch.start();
    }
    return dispatch;
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean(MeshDispatch.class)
  public DispatchCoordinator dispatchCoordinator(MeshDispatch meshDispatch) {
    return meshDispatch.coordinator();
  }
}
