package ca.gc.cra.uvcalc.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class AirMassTest {

  @Test
  void zenithSunGivesUnitAirMass() {
    assertEquals(1.0, AirMass.of(0), 1e-12);
  }

  @Test
  void matchesReferenceValuesAtLowSun() {
    assertEquals(3.69, AirMass.of(75), 0.01);
    assertEquals(8.33, AirMass.of(85), 0.01);
  }

  @Test
  void growsWithZenithAngle() {
    double previous = AirMass.of(0);
    for (int sza = 5; sza <= 85; sza += 5) {
      double current = AirMass.of(sza);
      assertTrue(current > previous, "air mass should grow at " + sza);
      previous = current;
    }
  }
}
