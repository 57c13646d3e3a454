/*
 * Copyright (C) 2025 Isima, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.isima.ictc.transform;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import io.isima.ictc.testutils.TestTables;
import org.junit.Test;

public class RobustScalerTest {

  @Test
  public void testCentered() {
    // R-7 quartiles of 1..9 are 3 and 7, the median is 5
    final var train = TestTables.matrix("x", 9, 1, 2, 3, 4, 5, 6, 7, 8);
    final var fitted = new RobustScaler(true).fit(train);

    assertEquals(5.0, fitted.getCenters().get("x"), 0.0);
    assertEquals(4.0, fitted.getScales().get("x"), 0.0);
    assertArrayEquals(
        new double[] {-1.0, 0.0, 1.25},
        fitted.apply(TestTables.matrix("x", 1, 5, 10)).getColumn("x"),
        1e-12);
  }

  @Test
  public void testInterpolatedQuartiles() {
    final var fitted = new RobustScaler(true).fit(TestTables.matrix("x", 1, 2, 3, 4));
    assertEquals(2.5, fitted.getCenters().get("x"), 1e-12);
    assertEquals(3.25 - 1.75, fitted.getScales().get("x"), 1e-12);
  }

  @Test
  public void testNotCentered() {
    final var fitted = new RobustScaler(false).fit(TestTables.matrix("x", 1, 2, 3, 4, 5));
    assertEquals(0.0, fitted.getCenters().get("x"), 0.0);
    assertArrayEquals(
        new double[] {0.5, 2.5},
        fitted.apply(TestTables.matrix("x", 1, 5)).getColumn("x"),
        1e-12);
  }

  @Test
  public void testZeroScale() {
    final var fitted = new RobustScaler(true).fit(TestTables.matrix("x", 3, 3, 3, 3, 50));
    assertEquals(0.0, fitted.getScales().get("x"), 0.0);
    assertArrayEquals(
        new double[] {0, 0, 0},
        fitted.apply(TestTables.matrix("x", 3, 50, -7)).getColumn("x"),
        0.0);
  }
}
