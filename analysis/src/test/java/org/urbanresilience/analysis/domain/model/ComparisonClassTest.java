package org.urbanresilience.analysis.domain.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class ComparisonClassTest {

  @Test
  void reachabilityChangesTakePrecedence() {
    assertEquals(ComparisonClass.NEWLY_UNREACHABLE, ComparisonClass.of(100.0, null));
    assertEquals(ComparisonClass.NEWLY_REACHABLE, ComparisonClass.of(null, 100.0));
    assertEquals(ComparisonClass.UNREACHABLE, ComparisonClass.of(null, null));
  }

  @Test
  void classifiesRelativeIncrease() {
    assertEquals(ComparisonClass.SEVERELY_DEGRADED, ComparisonClass.of(100.0, 151.0));
    assertEquals(ComparisonClass.MODERATELY_DEGRADED, ComparisonClass.of(100.0, 150.0));
    assertEquals(ComparisonClass.MODERATELY_DEGRADED, ComparisonClass.of(100.0, 121.0));
    assertEquals(ComparisonClass.LIGHTLY_DEGRADED, ComparisonClass.of(100.0, 120.0));
    assertEquals(ComparisonClass.LIGHTLY_DEGRADED, ComparisonClass.of(100.0, 100.5));
    assertEquals(ComparisonClass.IMPROVED_OR_SAME, ComparisonClass.of(100.0, 100.0));
    assertEquals(ComparisonClass.IMPROVED_OR_SAME, ComparisonClass.of(100.0, 80.0));
  }

  @Test
  void anyIncreaseFromZeroIsSevere() {
    assertEquals(ComparisonClass.SEVERELY_DEGRADED, ComparisonClass.of(0.0, 1.0));
    assertEquals(ComparisonClass.IMPROVED_OR_SAME, ComparisonClass.of(0.0, 0.0));
  }

  @Test
  void onlyIncreaseClassesCountAsDegraded() {
    assertTrue(ComparisonClass.LIGHTLY_DEGRADED.isDegraded());
    assertFalse(ComparisonClass.NEWLY_UNREACHABLE.isDegraded());
    assertFalse(ComparisonClass.IMPROVED_OR_SAME.isDegraded());
  }
}
