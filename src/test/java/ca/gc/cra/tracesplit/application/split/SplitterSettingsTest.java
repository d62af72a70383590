package ca.gc.cra.tracesplit.application.split;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.tracesplit.domain.split.SplitConfigurationException;
import org.junit.jupiter.api.Test;

class SplitterSettingsTest {

  @Test
  void derivesRepetitionsAndTestFraction() {
    SplitterSettings settings = new SplitterSettings(10, 2, 0.0, false, false, 0.5, 1L);

    assertEquals(20, settings.repetitions());
    assertEquals(0.1, settings.testFraction(), 1e-12);
    assertFalse(settings.hasValidation());
  }

  @Test
  void rejectsInvalidParameters() {
    assertThrows(SplitConfigurationException.class, () -> new SplitterSettings(1, 1, 0.1, false, false, 0.5, 1L));
    assertThrows(SplitConfigurationException.class, () -> new SplitterSettings(2, 0, 0.1, false, false, 0.5, 1L));
    assertThrows(SplitConfigurationException.class, () -> new SplitterSettings(2, 1, 1.0, false, false, 0.5, 1L));
    assertThrows(SplitConfigurationException.class, () -> new SplitterSettings(2, 1, 0.1, false, false, 1.5, 1L));
  }
}
