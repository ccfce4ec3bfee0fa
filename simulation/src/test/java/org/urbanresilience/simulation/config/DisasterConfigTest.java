package org.urbanresilience.simulation.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.urbanresilience.core.config.EnvironmentReader;
import org.urbanresilience.simulation.disaster.VulnerabilityLevel;

final class DisasterConfigTest {

  @Test
  void defaultsMatchTheStormModel() {
    DisasterConfig config = DisasterConfig.defaults();

    assertEquals(5.0, config.getIntensity());
    assertEquals(0.8, config.getCollapseRate(VulnerabilityLevel.I));
    assertEquals(0.5, config.getCollapseRate(VulnerabilityLevel.II));
    assertEquals(0.1, config.getCollapseRate(VulnerabilityLevel.III));
    assertEquals(10, config.getCrossSectionSamples());
    assertNull(config.getRandomSeed());
  }

  @Test
  void intensityOutsideScaleIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new DisasterConfig.Builder().intensity(0.5));
    assertThrows(IllegalArgumentException.class, () -> new DisasterConfig.Builder().intensity(10.5));
    assertThrows(IllegalArgumentException.class, () -> new DisasterConfig.Builder().intensity(Double.NaN));
  }

  @Test
  void collapseRateMustBeAProbability() {
    DisasterConfig.Builder builder = new DisasterConfig.Builder();

    assertThrows(IllegalArgumentException.class, () -> builder.collapseRate(VulnerabilityLevel.I, 1.2));
    assertThrows(IllegalArgumentException.class, () -> builder.collapseRate(VulnerabilityLevel.I, -0.1));
    assertThrows(IllegalArgumentException.class, () -> builder.crossSectionSamples(1));
  }

  @Test
  void readsEnvironment() {
    Map<String, String> env = new HashMap<>();
    env.put("DISASTER_INTENSITY", "8.5");
    env.put("RANDOM_SEED", "42");

    DisasterConfig config = DisasterConfig.fromEnvironment(EnvironmentReader.of(env));

    assertEquals(8.5, config.getIntensity());
    assertEquals(42L, config.getRandomSeed());
  }
}
