package org.urbanresilience.analysis.domain.model;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

final class ServiceLevelTest {

  @Test
  void bandsAreInclusiveAtTheirUpperBound() {
    assertEquals(ServiceLevel.EXCELLENT, ServiceLevel.of(0.0));
    assertEquals(ServiceLevel.EXCELLENT, ServiceLevel.of(300.0));
    assertEquals(ServiceLevel.GOOD, ServiceLevel.of(300.5));
    assertEquals(ServiceLevel.GOOD, ServiceLevel.of(600.0));
    assertEquals(ServiceLevel.FAIR, ServiceLevel.of(900.0));
    assertEquals(ServiceLevel.POOR, ServiceLevel.of(900.1));
  }

  @Test
  void missingTimeIsUnreachable() {
    assertEquals(ServiceLevel.UNREACHABLE, ServiceLevel.of(null));
    assertEquals(ServiceLevel.UNREACHABLE, ServiceLevel.of(Double.NaN));
  }
}
