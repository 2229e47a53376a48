package io.meshdispatch.spring.boot;

import io.meshdispatch.micrometer.MicrometerMetricsExporter;
import io.meshdispatch.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath and
 * {@code meshdispatch.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link MeshDispatchAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the {@link io.meshdispatch.MeshDispatch} composite.
 */
@AutoConfiguration(before = MeshDispatchAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "meshdispatch.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(MeshDispatchProperties.class)
public class MeshDispatchMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, MeshDispatchProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
