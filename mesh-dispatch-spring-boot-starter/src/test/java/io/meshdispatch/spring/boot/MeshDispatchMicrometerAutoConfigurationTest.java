package io.meshdispatch.spring.boot;

import io.meshdispatch.micrometer.MicrometerMetricsExporter;
import io.meshdispatch.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

class MeshDispatchMicrometerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(MeshDispatchMicrometerAutoConfiguration.class))
      .withUserConfiguration(MeterRegistryConfig.class);

  @Test
  void createsExporterByDefault() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("micrometerMetricsExporter"));
      assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
      MeterRegistry registry = ctx.getBean(MeterRegistry.class);
      assertNotNull(registry.find("meshdispatch.inbound.received").counter());
      assertNotNull(registry.find("meshdispatch.ack.pending").gauge());
    });
  }

  @Test
  void honorsCustomNamePrefix() {
    runner.withPropertyValues("meshdispatch.metrics.name-prefix=depot1.dispatch").run(ctx -> {
      MeterRegistry registry = ctx.getBean(MeterRegistry.class);
      ctx.getBean(MetricsExporter.class).incrementAckExhausted();
      assertEquals(1.0, registry.find("depot1.dispatch.ack.exhausted").counter().count());
      assertNull(registry.find("meshdispatch.ack.exhausted").counter());
    });
  }

  @Test
  void disabledByProperty() {
    runner.withPropertyValues("meshdispatch.metrics.enabled=false")
        .run(ctx -> assertFalse(ctx.containsBean("micrometerMetricsExporter")));
  }

  @Test
  void backsOffWhenUserProvidesExporter() {
    runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
      assertFalse(ctx.containsBean("micrometerMetricsExporter"));
      assertSame(MetricsExporter.NOOP, ctx.getBean(MetricsExporter.class));
    });
  }

  @Configuration(proxyBeanMethods = false)
  static class MeterRegistryConfig {
    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @Configuration(proxyBeanMethods = false)
  static class CustomExporterConfig {
    @Bean
    MetricsExporter customExporter() {
      return MetricsExporter.NOOP;
    }
  }
}
