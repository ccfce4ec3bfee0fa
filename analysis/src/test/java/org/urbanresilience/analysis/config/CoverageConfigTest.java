package org.urbanresilience.analysis.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.urbanresilience.core.config.EnvironmentReader;
import org.urbanresilience.simulation.network.VehicleType;

final class CoverageConfigTest {

  @Test
  void defaults() {
    CoverageConfig config = CoverageConfig.fromEnvironment(EnvironmentReader.of(Collections.emptyMap()));

    assertEquals(100.0, config.getGridSizeMeters());
    assertEquals(900.0, config.getMaxResponseTimeSeconds());
    assertEquals(VehicleType.AMBULANCE, config.getVehicleType());
  }

  @Test
  void readsEnvironment() {
    Map<String, String> env = new HashMap<>();
    env.put("COVERAGE_GRID_SIZE", "250");
    env.put("COVERAGE_MAX_RESPONSE_TIME", "600");
    env.put("COVERAGE_VEHICLE", " fire_truck ");

    CoverageConfig config = CoverageConfig.fromEnvironment(EnvironmentReader.of(env));

    assertEquals(250.0, config.getGridSizeMeters());
    assertEquals(600.0, config.getMaxResponseTimeSeconds());
    assertEquals(VehicleType.FIRE_TRUCK, config.getVehicleType());
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> new CoverageConfig.Builder().gridSizeMeters(0));
    assertThrows(IllegalArgumentException.class, () -> new CoverageConfig.Builder().maxResponseTimeSeconds(-5));
    assertThrows(IllegalArgumentException.class, () -> CoverageConfig.fromEnvironment(
        EnvironmentReader.of(Collections.singletonMap("COVERAGE_VEHICLE", "bicycle"))));
  }
}
