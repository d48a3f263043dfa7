/*
 * Copyright Myrrix Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.linsolve.common;

import org.junit.Assert;
import org.junit.Before;
import org.junit.BeforeClass;

import net.linsolve.common.log.MemoryHandler;
import net.linsolve.common.random.RandomMatrices;

public abstract class LinSolveTest extends Assert {

  private static final double DOUBLE_EPSILON = 1.0e-9;

  @SuppressWarnings("deprecation")
  public static void assertEquals(double expected, double actual) {
    Assert.assertEquals(expected, actual, DOUBLE_EPSILON);
  }

  @SuppressWarnings("deprecation")
  public static void assertEquals(String message, double expected, double actual) {
    Assert.assertEquals(message, expected, actual, DOUBLE_EPSILON);
  }

  public static void assertArrayEquals(double[] expecteds, double[] actuals) {
    Assert.assertArrayEquals(expecteds, actuals, DOUBLE_EPSILON);
  }

  /**
   * Asserts that two matrices, given as rows, have the same shape and entries.
   */
  public static void assertMatrixEquals(double[][] expecteds, double[][] actuals) {
    assertEquals("Row count", expecteds.length, actuals.length);
    for (int row = 0; row < expecteds.length; row++) {
      Assert.assertArrayEquals("Row " + row, expecteds[row], actuals[row], DOUBLE_EPSILON);
    }
  }

  @BeforeClass
  public static void setUpClass() {
    MemoryHandler.setSensibleLogFormat();
  }

  @Before
  public void setUp() throws Exception {
    RandomMatrices.useTestSeed();
  }

}
