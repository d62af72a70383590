package ca.gc.cra.tracesplit.config;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.tracesplit.infrastructure.labels.Hdf5LabelStoreReader;
import ca.gc.cra.tracesplit.infrastructure.metrics.NoOpMetricsAdapter;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  @Test
  void selectsMetricsAdapterByExporter() {
    assertInstanceOf(NoOpMetricsAdapter.class, CompositionRoot.metricsFor("none"));
    assertInstanceOf(NoOpMetricsAdapter.class, CompositionRoot.metricsFor(null));
    assertThrows(IllegalArgumentException.class, () -> CompositionRoot.metricsFor("statsd"));
  }

  @Test
  void wiresReaderAndUseCase() {
    SplitConfig config = SplitConfig.fromMap(Map.of("in", "labels.h5"));

    try (CompositionRoot root = new CompositionRoot("none")) {
      assertInstanceOf(Hdf5LabelStoreReader.class, root.labelStoreReader(config.source()));
      assertNotNull(root.splitUseCase(config, false));
    }
  }
}
