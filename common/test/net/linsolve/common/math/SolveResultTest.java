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

package net.linsolve.common.math;

import org.junit.Test;

import net.linsolve.common.LinSolveTest;

/**
 * Tests {@link SolveResult} and {@link RowEchelonForm}.
 */
public final class SolveResultTest extends LinSolveTest {

  @Test
  public void testSolved() {
    double[] x = {1.0, 2.0};
    SolveResult result = SolveResult.solved(x);
    assertFalse(result.isSingular());
    assertEquals(2, result.getDimension());
    assertArrayEquals(x, result.getSolution());
    assertEquals("Solved[1.0, 2.0]", result.toString());
  }

  @Test
  public void testSingular() {
    SolveResult result = SolveResult.singular(4);
    assertTrue(result.isSingular());
    assertEquals(4, result.getDimension());
    assertEquals("Singular", result.toString());
    try {
      result.getSolution();
      fail();
    } catch (SingularMatrixSolverException smse) {
      assertEquals(4, smse.getDimension());
      assertTrue(smse instanceof SolverException);
    }
  }

  @Test
  public void testSingularEchelonForm() {
    RowEchelonForm form = RowEchelonForm.singular(3);
    assertTrue(form.isSingular());
    assertEquals("RowEchelonForm[singular]", form.toString());
    try {
      form.getMatrix();
      fail();
    } catch (SingularMatrixSolverException smse) {
      assertEquals(3, smse.getDimension());
    }
  }

  @Test
  public void testEchelonFormMatrixIsCopy() {
    RowEchelonForm form = RowEchelonForm.of(MatrixUtils.toMatrix(new double[][] {{1.0, 2.0}}));
    form.getMatrix().setEntry(0, 0, 5.0);
    assertEquals(1.0, form.getMatrix().getEntry(0, 0));
  }

}
