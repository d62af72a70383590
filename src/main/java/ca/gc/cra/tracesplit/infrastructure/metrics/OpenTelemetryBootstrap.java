package ca.gc.cra.tracesplit.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the meter used by {@link OpenTelemetryMetricsAdapter}.
 *
 * <p>Settings come from {@code otel.*} system properties, then the matching {@code OTEL_*} environment variables.
 * A split run lasts seconds, so the periodic reader mostly serves as a carrier: the real export happens when the
 * handle is flushed on close.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.tracesplit";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(10);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  /**
   * Resolves the settings from the environment and builds a handle; any failure degrades to a noop handle.
   */
  static MeterHandle initialize() {
    ExporterSettings settings;
    try {
      settings = ExporterSettings.fromEnvironment();
    } catch (RuntimeException ex) {
      log.error("Unreadable OpenTelemetry settings; metrics disabled", ex);
      return MeterHandle.noop();
    }
    if (settings.mode() == ExporterMode.NONE) {
      log.debug("Metrics exporter is none; split metrics are dropped");
      return MeterHandle.noop();
    }
    try {
      OtlpGrpcMetricExporter exporter = OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
      log.info("Split metrics will be pushed over OTLP to {}", settings.endpoint());
      return open(reader, settings.resourceAttributes());
    } catch (RuntimeException ex) {
      log.error("Failed to start the OTLP metrics exporter for {}; metrics disabled", settings.endpoint(), ex);
      return MeterHandle.noop();
    }
  }

  static MeterHandle forTesting(MetricReader reader) {
    return open(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static MeterHandle open(MetricReader reader, Attributes extraResource) {
    String version = implementationVersion();
    Resource resource = Resource.getDefault().merge(Resource.create(Attributes.of(
        AttributeKey.stringKey("service.name"), "tracesplit",
        AttributeKey.stringKey("service.version"), version)));
    if (!extraResource.isEmpty()) {
      resource = resource.merge(Resource.create(extraResource));
    }
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
    return new MeterHandle(meter, provider);
  }

  /**
   * Parses {@code key=value} pairs separated by commas; malformed pairs are logged and skipped.
   */
  static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    if (raw == null) {
      return builder.build();
    }
    for (String pair : raw.split(",")) {
      if (pair.isBlank()) {
        continue;
      }
      String[] parts = pair.split("=", 2);
      String key = parts[0].trim();
      String value = parts.length == 2 ? parts[1].trim() : "";
      if (key.isEmpty() || value.isEmpty()) {
        log.warn("Skipping resource attribute without key or value: {}", pair.trim());
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  // Filled from the jar manifest; unpackaged test runs report "dev".
  private static String implementationVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? "dev" : version;
  }

  private static String setting(String property, String env, String defaultValue) {
    String value = System.getProperty(property);
    if (value == null || value.isBlank()) {
      value = System.getenv(env);
    }
    return value == null || value.isBlank() ? defaultValue : value.trim();
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      if (normalized.equals("otlp")) {
        return OTLP;
      }
      if (!normalized.isEmpty() && !normalized.equals("none")) {
        log.warn("Metrics exporter '{}' is not supported; metrics disabled", raw);
      }
      return NONE;
    }
  }

  record ExporterSettings(ExporterMode mode, String endpoint, Attributes resourceAttributes) {
    static ExporterSettings fromEnvironment() {
      return new ExporterSettings(
          ExporterMode.from(setting("otel.metrics.exporter", "OTEL_METRICS_EXPORTER", "none")),
          setting("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_ENDPOINT),
          parseResourceAttributes(setting("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES", "")));
    }
  }

  /** Meter plus the provider that owns it; the provider is absent in noop mode. */
  static final class MeterHandle implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private MeterHandle(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static MeterHandle noop() {
      return new MeterHandle(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null && !await(provider.forceFlush())) {
        log.warn("Split metrics were not flushed within {}s", SHUTDOWN_TIMEOUT_SECONDS);
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        if (!await(provider.shutdown())) {
          log.warn("Meter provider did not shut down within {}s", SHUTDOWN_TIMEOUT_SECONDS);
        }
      } catch (RuntimeException ex) {
        log.warn("Meter provider shutdown failed", ex);
      }
    }

    private static boolean await(CompletableResultCode result) {
      return result.join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS).isSuccess();
    }
  }
}
